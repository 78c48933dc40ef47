package com.promptvault.service;

import com.promptvault.exception.PromptNotFoundException;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.RenderedPrompt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Tests for PromptTemplateService.
 */
@ExtendWith(MockitoExtension.class)
class PromptTemplateServiceTest {

    @Mock
    private PromptService promptService;

    private PromptTemplateService templateService;

    @BeforeEach
    void setUp() {
        templateService = new PromptTemplateService(promptService);
    }

    @Test
    void testExtractVariables() {
        String content = "Translate {{ text }} into {{language}}. Keep {{text}} short. {{ }}";

        assertEquals(List.of("text", "language"), templateService.extractVariables(content));
    }

    @Test
    void testExtractVariablesWithoutPlaceholders() {
        assertTrue(templateService.extractVariables("Plain prompt with {single} braces").isEmpty());
        assertTrue(templateService.extractVariables(null).isEmpty());
    }

    @Test
    void testRenderLeavesUnknownPlaceholders() {
        String rendered = templateService.render(
                "Dear {{ name }}, your order {{order}} ships {{when}}.",
                Map.of("name", "Ada", "order", "#42"));

        assertEquals("Dear Ada, your order #42 ships {{when}}.", rendered);
    }

    @Test
    void testRenderValuesAreInsertedLiterally() {
        String rendered = templateService.render("Cost: {{price}}", Map.of("price", "$5 \\ unit"));

        assertEquals("Cost: $5 \\ unit", rendered);
    }

    @Test
    void testRenderPrompt() {
        when(promptService.get(7L)).thenReturn(Optional.of(PromptDetail.builder()
                .id(7L)
                .title("Summary")
                .content("Summarize {{topic}} for {{audience}}")
                .build()));

        RenderedPrompt rendered = templateService.renderPrompt(7L, Map.of("topic", "JPA"));

        assertEquals(7L, rendered.getPromptId());
        assertEquals("Summarize JPA for {{audience}}", rendered.getContent());
        assertEquals(List.of("topic", "audience"), rendered.getVariables());
        assertEquals(List.of("audience"), rendered.getUnresolved());
    }

    @Test
    void testRenderMissingPrompt() {
        when(promptService.get(99L)).thenReturn(Optional.empty());

        assertThrows(PromptNotFoundException.class, () -> templateService.renderPrompt(99L, Map.of()));
    }
}
