package com.promptvault.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportVersionItem {

    private String content;

    private String changeNote;

    private OffsetDateTime createdAt;
}
