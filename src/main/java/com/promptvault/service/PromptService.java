package com.promptvault.service;

import com.promptvault.entity.PromptEntity;
import com.promptvault.entity.PromptVersionEntity;
import com.promptvault.exception.PromptNotFoundException;
import com.promptvault.exception.ValidationException;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.PromptVersionDetail;
import com.promptvault.model.dto.SavePromptRequest;
import com.promptvault.repository.PromptRepository;
import com.promptvault.repository.PromptVersionRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Prompt store: create, update, delete and read prompts together with their
 * append-only version history.
 *
 * Versioning policy:
 * - create always records one version ("initial version" unless a note is given)
 * - update records a version only when the content changed or a note was given
 *   ("content updated" when no note is given)
 */
@Slf4j
@Service
public class PromptService {

    static final String INITIAL_VERSION_NOTE = "initial version";
    static final String CONTENT_UPDATED_NOTE = "content updated";

    private final PromptRepository promptRepository;
    private final PromptVersionRepository versionRepository;

    public PromptService(PromptRepository promptRepository,
                         PromptVersionRepository versionRepository) {
        this.promptRepository = promptRepository;
        this.versionRepository = versionRepository;
    }

    /**
     * Create when the request has no id, update otherwise.
     */
    @Transactional
    public PromptDetail upsert(SavePromptRequest request) {
        if (request.getId() == null) {
            return create(request.getTitle(), request.getContent(), request.getTags(),
                    Boolean.TRUE.equals(request.getIsFavorite()), request.getChangeNote());
        }
        return update(request.getId(), request.getTitle(), request.getContent(), request.getTags(),
                Boolean.TRUE.equals(request.getIsFavorite()), request.getChangeNote());
    }

    @Transactional
    public PromptDetail create(String title, String content, List<String> tags,
                               boolean isFavorite, String changeNote) {
        String normalizedTitle = requireTitle(title);
        requireContent(content);

        OffsetDateTime timestamp = PromptMappers.now();
        PromptEntity prompt = promptRepository.save(PromptEntity.builder()
                .title(normalizedTitle)
                .content(content)
                .tags(TagNormalizer.encode(TagNormalizer.normalize(tags)))
                .isFavorite(isFavorite)
                .scoreAvg(0.0)
                .scoreCount(0L)
                .createdAt(timestamp)
                .updatedAt(timestamp)
                .build());

        String note = StringUtils.stripToEmpty(changeNote);
        appendVersion(prompt.getId(), content, note.isEmpty() ? INITIAL_VERSION_NOTE : note, timestamp);

        log.info("Created prompt: id={}, title={}", prompt.getId(), normalizedTitle);
        return PromptMappers.toDetail(prompt);
    }

    @Transactional
    public PromptDetail update(Long id, String title, String content, List<String> tags,
                               boolean isFavorite, String changeNote) {
        String normalizedTitle = requireTitle(title);
        requireContent(content);
        PromptEntity prompt = promptRepository.findById(id)
                .orElseThrow(() -> PromptNotFoundException.forId(id));

        String previousContent = prompt.getContent();
        String note = StringUtils.stripToEmpty(changeNote);
        OffsetDateTime timestamp = PromptMappers.now();

        prompt.setTitle(normalizedTitle);
        prompt.setContent(content);
        prompt.setTags(TagNormalizer.encode(TagNormalizer.normalize(tags)));
        prompt.setIsFavorite(isFavorite);
        prompt.setUpdatedAt(timestamp);
        PromptEntity saved = promptRepository.save(prompt);

        boolean contentChanged = !Objects.equals(previousContent, content);
        if (contentChanged || !note.isEmpty()) {
            appendVersion(id, content, note.isEmpty() ? CONTENT_UPDATED_NOTE : note, timestamp);
            log.info("Updated prompt with new version: id={}, contentChanged={}", id, contentChanged);
        } else {
            log.info("Updated prompt metadata: id={}", id);
        }

        return PromptMappers.toDetail(saved);
    }

    /**
     * Delete a prompt; the database cascades to its versions and usage logs.
     * Unknown ids are ignored.
     */
    @Transactional
    public void delete(Long id) {
        if (!promptRepository.existsById(id)) {
            log.debug("Delete ignored, prompt not found: id={}", id);
            return;
        }
        promptRepository.deleteById(id);
        log.info("Deleted prompt: id={}", id);
    }

    @Transactional(readOnly = true)
    public Optional<PromptDetail> get(Long id) {
        return promptRepository.findById(id)
                .map(PromptMappers::toDetail);
    }

    /**
     * Version history, newest first. Empty for unknown ids.
     */
    @Transactional(readOnly = true)
    public List<PromptVersionDetail> listVersions(Long promptId) {
        return versionRepository.findByPromptIdOrderByCreatedAtDescIdDesc(promptId).stream()
                .map(PromptMappers::toDetail)
                .collect(Collectors.toList());
    }

    private void appendVersion(Long promptId, String content, String note, OffsetDateTime createdAt) {
        versionRepository.save(PromptVersionEntity.builder()
                .promptId(promptId)
                .content(content)
                .changeNote(note)
                .createdAt(createdAt)
                .build());
    }

    private static String requireTitle(String title) {
        String trimmed = StringUtils.stripToEmpty(title);
        if (trimmed.isEmpty()) {
            throw new ValidationException("Title must not be empty");
        }
        return trimmed;
    }

    private static void requireContent(String content) {
        if (StringUtils.isBlank(content)) {
            throw new ValidationException("Content must not be empty");
        }
    }
}
