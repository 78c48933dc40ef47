package com.promptvault.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One prompt read from a snapshot. Every field is optional at this level;
 * the importer decides what is usable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportPromptItem {

    private String title;

    private String content;

    private List<String> tags;

    private Boolean isFavorite;

    private Double scoreAvg;

    private Long scoreCount;

    private List<ImportVersionItem> versions;
}
