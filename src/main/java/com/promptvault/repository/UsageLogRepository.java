package com.promptvault.repository;

import com.promptvault.entity.UsageLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UsageLogRepository extends JpaRepository<UsageLogEntity, Long> {

    List<UsageLogEntity> findByPromptIdOrderByUsedAtDescIdDesc(Long promptId);

    long countByPromptId(Long promptId);
}
