package com.promptvault.service;

import com.promptvault.entity.PromptEntity;
import com.promptvault.entity.PromptVersionEntity;
import com.promptvault.entity.UsageLogEntity;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.PromptVersionDetail;
import com.promptvault.model.dto.UsageLogDetail;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Entity to view conversions shared by the services.
 */
final class PromptMappers {

    private PromptMappers() {
    }

    /**
     * Current time at the resolution the database keeps.
     */
    static OffsetDateTime now() {
        return OffsetDateTime.now().truncatedTo(ChronoUnit.MICROS);
    }

    static PromptDetail toDetail(PromptEntity entity) {
        return PromptDetail.builder()
                .id(entity.getId())
                .title(entity.getTitle())
                .content(entity.getContent())
                .tags(TagNormalizer.decode(entity.getTags()))
                .isFavorite(Boolean.TRUE.equals(entity.getIsFavorite()))
                .scoreAvg(entity.effectiveScoreAvg())
                .scoreCount(entity.getScoreCount() != null ? entity.getScoreCount() : 0L)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    static PromptVersionDetail toDetail(PromptVersionEntity entity) {
        return PromptVersionDetail.builder()
                .id(entity.getId())
                .promptId(entity.getPromptId())
                .content(entity.getContent())
                .changeNote(entity.getChangeNote())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    static UsageLogDetail toDetail(UsageLogEntity entity) {
        return UsageLogDetail.builder()
                .id(entity.getId())
                .promptId(entity.getPromptId())
                .inputVars(entity.getInputVars())
                .outputText(entity.getOutputText())
                .rating(entity.getRating())
                .usedAt(entity.getUsedAt())
                .build();
    }
}
