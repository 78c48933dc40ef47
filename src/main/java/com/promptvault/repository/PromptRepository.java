package com.promptvault.repository;

import com.promptvault.entity.PromptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for prompts. Filtered listings go through {@link JpaSpecificationExecutor}.
 */
@Repository
public interface PromptRepository extends JpaRepository<PromptEntity, Long>, JpaSpecificationExecutor<PromptEntity> {

    /**
     * All prompts, most recently updated first (export order).
     */
    List<PromptEntity> findAllByOrderByUpdatedAtDescIdDesc();

    /**
     * Encoded tag blob of every prompt, for tag frequency aggregation.
     */
    @Query("SELECT p.tags FROM PromptEntity p")
    List<String> findAllEncodedTags();
}
