package com.promptvault.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One exported prompt. Ids and timestamps of the prompt itself are not exported;
 * they are reassigned on import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportPromptItem {

    private String title;

    private String content;

    private List<String> tags;

    private Boolean isFavorite;

    private Double scoreAvg;

    private Long scoreCount;

    /**
     * Full history, newest first.
     */
    private List<ExportVersionItem> versions;
}
