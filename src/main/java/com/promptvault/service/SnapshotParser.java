package com.promptvault.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptvault.exception.SnapshotParseException;
import com.promptvault.model.snapshot.ImportPayload;
import com.promptvault.model.snapshot.ImportPromptItem;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads snapshot text into an {@link ImportPayload}. Accepts the export document
 * (an object with a {@code prompts} list) or a bare list of prompt items.
 * Nothing here touches the store.
 */
@Component
public class SnapshotParser {

    private final ObjectMapper objectMapper;

    public SnapshotParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws SnapshotParseException malformed JSON, unexpected root shape, or an item of the wrong shape
     */
    public ImportPayload parse(String json) {
        if (StringUtils.isBlank(json)) {
            throw new SnapshotParseException("Snapshot is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SnapshotParseException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root.isArray()) {
            return new ImportPayload.Flat(readItems(root));
        }
        if (root.isObject()) {
            JsonNode prompts = root.get("prompts");
            if (prompts == null || !prompts.isArray()) {
                throw new SnapshotParseException("Snapshot object has no \"prompts\" list");
            }
            return new ImportPayload.Wrapped(readItems(prompts));
        }
        throw new SnapshotParseException("Snapshot must be a JSON array or an object with a \"prompts\" list");
    }

    private List<ImportPromptItem> readItems(JsonNode array) {
        List<ImportPromptItem> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            if (!node.isObject()) {
                throw new SnapshotParseException("Snapshot item " + i + " is not an object");
            }
            try {
                items.add(objectMapper.convertValue(node, ImportPromptItem.class));
            } catch (IllegalArgumentException e) {
                throw new SnapshotParseException("Snapshot item " + i + " is malformed: " + e.getMessage(), e);
            }
        }
        return items;
    }
}
