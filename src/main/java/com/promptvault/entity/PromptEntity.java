package com.promptvault.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * JPA entity for the prompts table.
 * Tags are kept in their encoded form (JSON array text); see TagNormalizer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "prompts")
public class PromptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "tags", nullable = false)
    private String tags;

    @Column(name = "is_favorite", nullable = false)
    private Boolean isFavorite;

    // Score aggregate
    @Column(name = "score_avg", nullable = false)
    private Double scoreAvg;

    @Column(name = "score_count", nullable = false)
    private Long scoreCount;

    // Timestamps
    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (tags == null) {
            tags = "[]";
        }
        if (isFavorite == null) {
            isFavorite = false;
        }
        if (scoreAvg == null) {
            scoreAvg = 0.0;
        }
        if (scoreCount == null) {
            scoreCount = 0L;
        }
    }

    /**
     * Fold one rating into the running mean.
     */
    public void applyRating(int rating, OffsetDateTime ratedAt) {
        long count = scoreCount != null ? scoreCount : 0L;
        double avg = count > 0 && scoreAvg != null ? scoreAvg : 0.0;
        long nextCount = count + 1;
        this.scoreAvg = (avg * count + rating) / nextCount;
        this.scoreCount = nextCount;
        this.updatedAt = ratedAt;
    }

    /**
     * Average as reported to callers: zero until the first rating.
     */
    public double effectiveScoreAvg() {
        if (scoreCount == null || scoreCount == 0 || scoreAvg == null) {
            return 0.0;
        }
        return scoreAvg;
    }
}
