package com.promptvault.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.promptvault.config.PromptVaultProperties;
import com.promptvault.entity.PromptEntity;
import com.promptvault.entity.PromptVersionEntity;
import com.promptvault.exception.SnapshotParseException;
import com.promptvault.exception.StorageException;
import com.promptvault.model.dto.ImportResult;
import com.promptvault.model.snapshot.ExportPayload;
import com.promptvault.model.snapshot.ExportPromptItem;
import com.promptvault.model.snapshot.ExportVersionItem;
import com.promptvault.model.snapshot.ImportPayload;
import com.promptvault.model.snapshot.ImportPromptItem;
import com.promptvault.model.snapshot.ImportVersionItem;
import com.promptvault.repository.PromptRepository;
import com.promptvault.repository.PromptVersionRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Full-fidelity export of the store and all-or-nothing import of a snapshot.
 *
 * Import rules per item:
 * - blank title or content: item skipped
 * - tags normalized, score count clamped to >= 0, average forced to 0 without ratings
 * - prompt timestamps are the import time
 * - non-empty versions are kept (missing note "imported version", missing time = import time);
 *   when none survive, one "imported" version is made from the prompt content
 */
@Slf4j
@Service
public class SnapshotService {

    static final String IMPORTED_VERSION_NOTE = "imported version";
    static final String SYNTHESIZED_VERSION_NOTE = "imported";

    private final PromptRepository promptRepository;
    private final PromptVersionRepository versionRepository;
    private final SnapshotParser snapshotParser;
    private final ObjectMapper objectMapper;
    private final PromptVaultProperties properties;

    public SnapshotService(PromptRepository promptRepository,
                           PromptVersionRepository versionRepository,
                           SnapshotParser snapshotParser,
                           ObjectMapper objectMapper,
                           PromptVaultProperties properties) {
        this.promptRepository = promptRepository;
        this.versionRepository = versionRepository;
        this.snapshotParser = snapshotParser;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Serialize every prompt (most recently updated first) with its version history.
     */
    @Transactional(readOnly = true)
    public String exportSnapshot() {
        List<ExportPromptItem> items = promptRepository.findAllByOrderByUpdatedAtDescIdDesc().stream()
                .map(this::toExportItem)
                .collect(Collectors.toList());

        ExportPayload payload = ExportPayload.builder()
                .exportedAt(PromptMappers.now())
                .prompts(items)
                .build();

        ObjectWriter writer = properties.getSnapshot().isPrettyPrint()
                ? objectMapper.writerWithDefaultPrettyPrinter()
                : objectMapper.writer();
        try {
            String json = writer.writeValueAsString(payload);
            log.info("Exported snapshot: prompts={}", items.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    /**
     * Merge a snapshot into the store in a single transaction.
     *
     * @return number of prompts imported
     * @throws SnapshotParseException unreadable snapshot; nothing written
     * @throws StorageException       database failure; the whole batch is rolled back
     */
    @Transactional
    public ImportResult importSnapshot(String json) {
        ImportPayload payload = snapshotParser.parse(json);
        List<ImportPromptItem> items = payload.getItems();

        long imported = 0;
        int skipped = 0;
        try {
            for (int i = 0; i < items.size(); i++) {
                if (importItem(items.get(i), i)) {
                    imported++;
                } else {
                    skipped++;
                }
            }
        } catch (DataAccessException | PersistenceException e) {
            log.error("Snapshot import failed after {} prompts, rolling back", imported, e);
            throw new StorageException("Snapshot import aborted; no prompts were imported", e);
        }

        log.info("Imported snapshot: shape={}, imported={}, skipped={}",
                payload.getClass().getSimpleName(), imported, skipped);
        return new ImportResult(imported);
    }

    private boolean importItem(ImportPromptItem item, int index) {
        String title = StringUtils.stripToEmpty(item.getTitle());
        String content = item.getContent();
        if (title.isEmpty() || StringUtils.isBlank(content)) {
            log.warn("Skipping snapshot item {}: empty title or content", index);
            return false;
        }

        long scoreCount = Math.max(0L, item.getScoreCount() != null ? item.getScoreCount() : 0L);
        double scoreAvg = scoreCount == 0 ? 0.0 : (item.getScoreAvg() != null ? item.getScoreAvg() : 0.0);
        if (scoreCount > 0 && !isPlausibleAverage(scoreAvg)) {
            log.warn("Snapshot item {} has inconsistent score (avg={}, count={}), resetting it",
                    index, scoreAvg, scoreCount);
            scoreCount = 0L;
            scoreAvg = 0.0;
        }

        OffsetDateTime importedAt = PromptMappers.now();
        PromptEntity prompt = promptRepository.save(PromptEntity.builder()
                .title(title)
                .content(content)
                .tags(TagNormalizer.encode(TagNormalizer.normalize(item.getTags())))
                .isFavorite(Boolean.TRUE.equals(item.getIsFavorite()))
                .scoreAvg(scoreAvg)
                .scoreCount(scoreCount)
                .createdAt(importedAt)
                .updatedAt(importedAt)
                .build());

        int insertedVersions = 0;
        if (item.getVersions() != null) {
            // exports list versions newest first; insert oldest first so ids follow time
            List<ImportVersionItem> versions = new ArrayList<>(item.getVersions());
            Collections.reverse(versions);
            for (ImportVersionItem version : versions) {
                if (version == null || StringUtils.isBlank(version.getContent())) {
                    continue;
                }
                versionRepository.save(PromptVersionEntity.builder()
                        .promptId(prompt.getId())
                        .content(version.getContent())
                        .changeNote(version.getChangeNote() != null ? version.getChangeNote() : IMPORTED_VERSION_NOTE)
                        .createdAt(version.getCreatedAt() != null ? version.getCreatedAt() : importedAt)
                        .build());
                insertedVersions++;
            }
        }

        if (insertedVersions == 0) {
            versionRepository.save(PromptVersionEntity.builder()
                    .promptId(prompt.getId())
                    .content(content)
                    .changeNote(SYNTHESIZED_VERSION_NOTE)
                    .createdAt(importedAt)
                    .build());
        }
        return true;
    }

    private static boolean isPlausibleAverage(double scoreAvg) {
        return !Double.isNaN(scoreAvg)
                && scoreAvg >= UsageService.MIN_RATING
                && scoreAvg <= UsageService.MAX_RATING;
    }

    private ExportPromptItem toExportItem(PromptEntity prompt) {
        List<ExportVersionItem> versions = versionRepository.findByPromptIdOrderByCreatedAtDescIdDesc(prompt.getId()).stream()
                .map(version -> ExportVersionItem.builder()
                        .content(version.getContent())
                        .changeNote(version.getChangeNote())
                        .createdAt(version.getCreatedAt())
                        .build())
                .collect(Collectors.toList());

        return ExportPromptItem.builder()
                .title(prompt.getTitle())
                .content(prompt.getContent())
                .tags(TagNormalizer.decode(prompt.getTags()))
                .isFavorite(Boolean.TRUE.equals(prompt.getIsFavorite()))
                .scoreAvg(prompt.effectiveScoreAvg())
                .scoreCount(prompt.getScoreCount() != null ? prompt.getScoreCount() : 0L)
                .versions(versions)
                .build();
    }
}
