package com.promptvault.service;

import com.promptvault.entity.PromptEntity;
import com.promptvault.model.SortMode;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.TagSummary;
import com.promptvault.repository.PromptRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the prompt library: filtered, sorted listings and tag frequencies.
 */
@Slf4j
@Service
public class PromptQueryService {

    private static final char LIKE_ESCAPE = '\\';

    private final PromptRepository promptRepository;

    public PromptQueryService(PromptRepository promptRepository) {
        this.promptRepository = promptRepository;
    }

    /**
     * List prompts matching all given filters.
     *
     * @param search    substring of title, content or encoded tags (case-insensitive); blank = no filter
     * @param tagFilter whole-tag match against the decoded tag list; blank = no filter
     * @param sortBy    "score", "created", anything else sorts by last update
     */
    @Transactional(readOnly = true)
    public List<PromptDetail> list(String search, String tagFilter, String sortBy) {
        String searchTerm = StringUtils.stripToEmpty(search);
        String tag = StringUtils.stripToEmpty(tagFilter);
        SortMode sortMode = SortMode.fromParameter(sortBy);

        log.debug("Listing prompts: search={}, tag={}, sort={}", searchTerm, tag, sortMode);

        List<PromptEntity> rows = promptRepository.findAll(buildSpecification(searchTerm), sortMode.getSort());

        return rows.stream()
                .map(PromptMappers::toDetail)
                .filter(prompt -> tag.isEmpty() || TagNormalizer.containsTag(prompt.getTags(), tag))
                .collect(Collectors.toList());
    }

    /**
     * Occurrence count of every tag across all prompts, most used first, then by name.
     */
    @Transactional(readOnly = true)
    public List<TagSummary> listTags() {
        Map<String, Long> counts = new HashMap<>();
        for (String encoded : promptRepository.findAllEncodedTags()) {
            for (String tag : TagNormalizer.decode(encoded)) {
                counts.merge(tag, 1L, Long::sum);
            }
        }

        return counts.entrySet().stream()
                .map(e -> TagSummary.builder()
                        .name(e.getKey())
                        .count(e.getValue())
                        .build())
                .sorted(Comparator.comparing(TagSummary::getCount).reversed()
                        .thenComparing(TagSummary::getName))
                .collect(Collectors.toList());
    }

    private Specification<PromptEntity> buildSpecification(String searchTerm) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (!searchTerm.isEmpty()) {
                String pattern = "%" + escapeLike(searchTerm.toLowerCase(Locale.ROOT)) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("title")), pattern, LIKE_ESCAPE),
                        cb.like(cb.lower(root.get("content")), pattern, LIKE_ESCAPE),
                        cb.like(cb.lower(root.get("tags")), pattern, LIKE_ESCAPE)
                ));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
