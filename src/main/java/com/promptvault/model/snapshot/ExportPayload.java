package com.promptvault.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Top-level export document: a timestamp and every prompt with its history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportPayload {

    private OffsetDateTime exportedAt;

    private List<ExportPromptItem> prompts;
}
