package com.promptvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A prompt as returned to callers, with its tags decoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptDetail {

    private Long id;

    private String title;

    private String content;

    /**
     * Normalized tags, first-seen order.
     */
    private List<String> tags;

    private Boolean isFavorite;

    /**
     * Running mean of all ratings; 0 while scoreCount is 0.
     */
    private Double scoreAvg;

    private Long scoreCount;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;
}
