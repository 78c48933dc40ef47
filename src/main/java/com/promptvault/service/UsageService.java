package com.promptvault.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.promptvault.entity.PromptEntity;
import com.promptvault.entity.UsageLogEntity;
import com.promptvault.exception.PromptNotFoundException;
import com.promptvault.exception.ValidationException;
import com.promptvault.model.dto.LogUsageRequest;
import com.promptvault.model.dto.UsageLogDetail;
import com.promptvault.repository.PromptRepository;
import com.promptvault.repository.UsageLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Usage and scoring ledger. Every call appends a usage log; a rated call also
 * folds the rating into the prompt's running mean. Log and score commit together.
 */
@Slf4j
@Service
public class UsageService {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final PromptRepository promptRepository;
    private final UsageLogRepository usageLogRepository;

    public UsageService(PromptRepository promptRepository,
                        UsageLogRepository usageLogRepository) {
        this.promptRepository = promptRepository;
        this.usageLogRepository = usageLogRepository;
    }

    @Transactional
    public void logUsage(Long promptId, LogUsageRequest request) {
        logUsage(promptId, request.getInputVars(), request.getOutputText(), request.getRating());
    }

    /**
     * Record one use of a prompt.
     *
     * @throws ValidationException     rating present and outside 1..5
     * @throws PromptNotFoundException no prompt with this id
     */
    @Transactional
    public void logUsage(Long promptId, JsonNode inputPayload, String outputText, Integer rating) {
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            throw new ValidationException("Rating must be between " + MIN_RATING + " and " + MAX_RATING + ": " + rating);
        }

        PromptEntity prompt = promptRepository.findById(promptId)
                .orElseThrow(() -> PromptNotFoundException.forId(promptId));

        OffsetDateTime usedAt = PromptMappers.now();
        usageLogRepository.save(UsageLogEntity.builder()
                .promptId(promptId)
                .inputVars(inputPayload != null ? inputPayload : JsonNodeFactory.instance.objectNode())
                .outputText(outputText != null ? outputText : "")
                .rating(rating)
                .usedAt(usedAt)
                .build());

        if (rating == null) {
            log.info("Logged usage: promptId={}", promptId);
            return;
        }

        prompt.applyRating(rating, usedAt);
        promptRepository.save(prompt);
        log.info("Logged rated usage: promptId={}, rating={}, scoreAvg={}, scoreCount={}",
                promptId, rating, prompt.getScoreAvg(), prompt.getScoreCount());
    }

    /**
     * Usage history of one prompt, newest first.
     */
    @Transactional(readOnly = true)
    public List<UsageLogDetail> listUsage(Long promptId) {
        return usageLogRepository.findByPromptIdOrderByUsedAtDescIdDesc(promptId).stream()
                .map(PromptMappers::toDetail)
                .collect(Collectors.toList());
    }
}
