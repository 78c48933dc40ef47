package com.promptvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of substituting template variables into a prompt's content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderedPrompt {

    private Long promptId;

    private String content;

    /**
     * Every placeholder name found in the template, first appearance order.
     */
    private List<String> variables;

    /**
     * Placeholders left in place because no value was supplied.
     */
    private List<String> unresolved;
}
