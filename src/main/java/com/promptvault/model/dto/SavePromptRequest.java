package com.promptvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Create-or-update payload. A null id creates a new prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SavePromptRequest {

    private Long id;

    private String title;

    private String content;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Boolean isFavorite = false;

    /**
     * Optional note for the version this save may append.
     */
    private String changeNote;
}
