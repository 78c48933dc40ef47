package com.promptvault.controller;

import com.promptvault.model.dto.LogUsageRequest;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.PromptVersionDetail;
import com.promptvault.model.dto.RenderPromptRequest;
import com.promptvault.model.dto.RenderedPrompt;
import com.promptvault.model.dto.SavePromptRequest;
import com.promptvault.model.dto.UsageLogDetail;
import com.promptvault.service.PromptQueryService;
import com.promptvault.service.PromptService;
import com.promptvault.service.PromptTemplateService;
import com.promptvault.service.UsageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Prompt library API: listing, CRUD, version history, usage logging and rendering.
 */
@Slf4j
@RestController
@RequestMapping("/v1/prompts")
public class PromptController {

    private final PromptService promptService;
    private final PromptQueryService promptQueryService;
    private final UsageService usageService;
    private final PromptTemplateService templateService;

    public PromptController(PromptService promptService,
                            PromptQueryService promptQueryService,
                            UsageService usageService,
                            PromptTemplateService templateService) {
        this.promptService = promptService;
        this.promptQueryService = promptQueryService;
        this.usageService = usageService;
        this.templateService = templateService;
    }

    /**
     * List prompts.
     *
     * @param search Substring of title, content or tags (optional)
     * @param tag Exact tag to filter by (optional)
     * @param sortBy "score", "created" or anything else for last updated (optional)
     * @return Matching prompts in the requested order
     */
    @GetMapping
    public ResponseEntity<List<PromptDetail>> listPrompts(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String sortBy) {
        return ResponseEntity.ok(promptQueryService.list(search, tag, sortBy));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PromptDetail> getPrompt(@PathVariable Long id) {
        return promptService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/versions")
    public ResponseEntity<List<PromptVersionDetail>> listVersions(@PathVariable Long id) {
        return ResponseEntity.ok(promptService.listVersions(id));
    }

    /**
     * Create a prompt, or update it when the body carries an id.
     */
    @PostMapping
    public ResponseEntity<PromptDetail> upsertPrompt(@RequestBody SavePromptRequest request) {
        log.info("Saving prompt: id={}", request.getId());
        return ResponseEntity.ok(promptService.upsert(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PromptDetail> updatePrompt(@PathVariable Long id,
                                                     @RequestBody SavePromptRequest request) {
        request.setId(id);
        log.info("Updating prompt: id={}", id);
        return ResponseEntity.ok(promptService.upsert(request));
    }

    /**
     * Delete a prompt with its history and usage logs. 204 also for unknown ids.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePrompt(@PathVariable Long id) {
        log.info("Deleting prompt: id={}", id);
        promptService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/usage")
    public ResponseEntity<Void> logUsage(@PathVariable Long id, @RequestBody LogUsageRequest request) {
        usageService.logUsage(id, request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/usage")
    public ResponseEntity<List<UsageLogDetail>> listUsage(@PathVariable Long id) {
        return ResponseEntity.ok(usageService.listUsage(id));
    }

    @PostMapping("/{id}/render")
    public ResponseEntity<RenderedPrompt> renderPrompt(@PathVariable Long id,
                                                       @RequestBody(required = false) RenderPromptRequest request) {
        return ResponseEntity.ok(templateService.renderPrompt(id, request != null ? request.getValues() : null));
    }
}
