package com.promptvault.service;

import com.promptvault.exception.PromptNotFoundException;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.RenderedPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Template variables inside prompt content.
 *
 * Placeholders look like {@code {{ name }}}; whitespace around the name is ignored
 * and the name itself may not contain braces.
 */
@Slf4j
@Service
public class PromptTemplateService {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private final PromptService promptService;

    public PromptTemplateService(PromptService promptService) {
        this.promptService = promptService;
    }

    /**
     * Distinct variable names in order of first appearance.
     */
    public List<String> extractVariables(String content) {
        Set<String> names = new LinkedHashSet<>();
        if (content == null) {
            return new ArrayList<>();
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Substitute known variables. Unknown ones are written back as {@code {{name}}}.
     */
    public String render(String content, Map<String, String> values) {
        if (content == null) {
            return "";
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(content);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            String value = values != null ? values.get(name) : null;
            String replacement = value != null ? value : "{{" + name + "}}";
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * Render a stored prompt. Read-only; logging the use is up to the caller.
     */
    public RenderedPrompt renderPrompt(Long promptId, Map<String, String> values) {
        PromptDetail prompt = promptService.get(promptId)
                .orElseThrow(() -> PromptNotFoundException.forId(promptId));

        List<String> variables = extractVariables(prompt.getContent());
        List<String> unresolved = new ArrayList<>();
        for (String name : variables) {
            if (values == null || values.get(name) == null) {
                unresolved.add(name);
            }
        }

        log.debug("Rendered prompt: id={}, variables={}, unresolved={}", promptId, variables.size(), unresolved.size());
        return RenderedPrompt.builder()
                .promptId(promptId)
                .content(render(prompt.getContent(), values))
                .variables(variables)
                .unresolved(unresolved)
                .build();
    }
}
