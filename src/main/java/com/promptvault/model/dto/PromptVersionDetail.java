package com.promptvault.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptVersionDetail {

    private Long id;

    private Long promptId;

    private String content;

    private String changeNote;

    private OffsetDateTime createdAt;
}
