package com.promptvault.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Immutable content snapshot of a prompt. Rows are only ever inserted;
 * the database removes them when the owning prompt is deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "prompt_versions")
public class PromptVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "prompt_id", nullable = false, updatable = false)
    private Long promptId;

    @Column(name = "content", nullable = false, updatable = false)
    private String content;

    @Column(name = "change_note", nullable = false, updatable = false)
    private String changeNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (changeNote == null) {
            changeNote = "";
        }
    }
}
