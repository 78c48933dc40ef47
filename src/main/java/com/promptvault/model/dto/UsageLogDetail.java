package com.promptvault.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageLogDetail {

    private Long id;

    private Long promptId;

    private JsonNode inputVars;

    private String outputText;

    private Integer rating;

    private OffsetDateTime usedAt;
}
