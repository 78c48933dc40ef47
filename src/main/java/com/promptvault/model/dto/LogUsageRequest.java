package com.promptvault.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogUsageRequest {

    /**
     * Template variable values or any other JSON the caller wants kept with the log.
     */
    private JsonNode inputVars;

    private String outputText;

    /**
     * 1..5, or null when no feedback was given.
     */
    private Integer rating;
}
