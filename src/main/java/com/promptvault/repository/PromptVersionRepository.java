package com.promptvault.repository;

import com.promptvault.entity.PromptVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only version history.
 */
@Repository
public interface PromptVersionRepository extends JpaRepository<PromptVersionEntity, Long> {

    /**
     * Versions of a prompt, newest first. Id breaks ties between equal timestamps.
     */
    List<PromptVersionEntity> findByPromptIdOrderByCreatedAtDescIdDesc(Long promptId);

    long countByPromptId(Long promptId);
}
