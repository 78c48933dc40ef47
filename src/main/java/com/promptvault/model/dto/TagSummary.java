package com.promptvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tag name and the number of prompts carrying it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagSummary {

    private String name;

    private Long count;
}
