package com.promptvault.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tag list normalization and its stored form.
 *
 * <p>Normalization trims every entry, drops blanks and removes case-insensitive
 * duplicates, keeping the first spelling and the first-seen order. It is idempotent.
 * The stored form is a JSON array, so substring search over the column still
 * finds tag names.
 */
@Slf4j
public final class TagNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private TagNormalizer() {
    }

    public static List<String> normalize(Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return new ArrayList<>();
        }

        Set<String> seen = new HashSet<>();
        List<String> normalized = new ArrayList<>();
        for (String tag : rawTags) {
            String trimmed = StringUtils.stripToEmpty(tag);
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                normalized.add(trimmed);
            }
        }
        return normalized;
    }

    public static String encode(List<String> tags) {
        try {
            return MAPPER.writeValueAsString(tags != null ? tags : List.of());
        } catch (JsonProcessingException e) {
            // a list of strings always serializes
            throw new IllegalStateException("Cannot encode tags", e);
        }
    }

    /**
     * Decode the stored form. Unreadable text yields an empty list.
     */
    public static List<String> decode(String encoded) {
        if (StringUtils.isBlank(encoded)) {
            return new ArrayList<>();
        }
        try {
            List<String> tags = MAPPER.readValue(encoded, STRING_LIST);
            return tags != null ? tags : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable tag column value: {}", encoded);
            return new ArrayList<>();
        }
    }

    /**
     * Whether the tag list contains the given tag as a whole tag (case-insensitive).
     */
    public static boolean containsTag(List<String> tags, String tag) {
        String wanted = StringUtils.stripToEmpty(tag);
        if (wanted.isEmpty() || tags == null) {
            return false;
        }
        for (String candidate : tags) {
            if (candidate != null && StringUtils.strip(candidate).equalsIgnoreCase(wanted)) {
                return true;
            }
        }
        return false;
    }
}
