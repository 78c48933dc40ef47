package com.promptvault.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.promptvault.repository.converter.JsonNodeConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One recorded use of a prompt. The input payload is opaque JSON stored verbatim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "usage_logs")
public class UsageLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "prompt_id", nullable = false, updatable = false)
    private Long promptId;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "input_vars", nullable = false, updatable = false)
    private JsonNode inputVars;

    @Column(name = "output_text", nullable = false, updatable = false)
    private String outputText;

    // null means no feedback was given
    @Column(name = "rating", updatable = false)
    private Integer rating;

    @Column(name = "used_at", nullable = false, updatable = false)
    private OffsetDateTime usedAt;
}
