package com.promptvault.controller;

import com.promptvault.model.dto.TagSummary;
import com.promptvault.service.PromptQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/tags")
public class TagController {

    private final PromptQueryService promptQueryService;

    public TagController(PromptQueryService promptQueryService) {
        this.promptQueryService = promptQueryService;
    }

    /**
     * Tag usage counts, most used first.
     */
    @GetMapping
    public ResponseEntity<List<TagSummary>> listTags() {
        return ResponseEntity.ok(promptQueryService.listTags());
    }
}
