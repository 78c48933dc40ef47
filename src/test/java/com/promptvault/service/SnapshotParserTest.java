package com.promptvault.service;

import com.promptvault.config.JacksonConfiguration;
import com.promptvault.exception.SnapshotParseException;
import com.promptvault.model.snapshot.ImportPayload;
import com.promptvault.model.snapshot.ImportPromptItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SnapshotParser.
 */
class SnapshotParserTest {

    private SnapshotParser parser;

    @BeforeEach
    void setUp() {
        parser = new SnapshotParser(new JacksonConfiguration().objectMapper());
    }

    @Test
    void testParseWrappedShape() {
        ImportPayload payload = parser.parse("""
                {
                  "exportedAt": "2026-01-02T03:04:05+08:00",
                  "prompts": [
                    {
                      "title": "Greeting",
                      "content": "Hello {{name}}",
                      "tags": ["demo"],
                      "isFavorite": true,
                      "scoreAvg": 4.5,
                      "scoreCount": 2,
                      "versions": [
                        {"content": "Hello {{name}}", "changeNote": "tweak", "createdAt": "2026-01-01T00:00:00Z"}
                      ]
                    }
                  ]
                }
                """);

        assertInstanceOf(ImportPayload.Wrapped.class, payload);
        assertEquals(1, payload.getItems().size());

        ImportPromptItem item = payload.getItems().get(0);
        assertEquals("Greeting", item.getTitle());
        assertTrue(item.getIsFavorite());
        assertEquals(2L, item.getScoreCount());
        assertEquals("tweak", item.getVersions().get(0).getChangeNote());
        assertNotNull(item.getVersions().get(0).getCreatedAt());
    }

    @Test
    void testParseFlatShape() {
        ImportPayload payload = parser.parse("[{\"title\": \"A\", \"content\": \"a\"}, {\"title\": \"B\", \"content\": \"b\"}]");

        assertInstanceOf(ImportPayload.Flat.class, payload);
        assertEquals(2, payload.getItems().size());
        assertNull(payload.getItems().get(0).getVersions());
    }

    @Test
    void testParseIgnoresUnknownFields() {
        ImportPayload payload = parser.parse("[{\"title\": \"A\", \"content\": \"a\", \"id\": 12, \"createdAt\": \"x\"}]");

        assertEquals("A", payload.getItems().get(0).getTitle());
    }

    @Test
    void testParseRejectsMalformedInput() {
        assertThrows(SnapshotParseException.class, () -> parser.parse("{not json"));
        assertThrows(SnapshotParseException.class, () -> parser.parse(""));
        assertThrows(SnapshotParseException.class, () -> parser.parse("42"));
        assertThrows(SnapshotParseException.class, () -> parser.parse("{\"items\": []}"));
        assertThrows(SnapshotParseException.class, () -> parser.parse("[1, 2]"));
    }

    @Test
    void testParseRejectsWrongFieldTypes() {
        assertThrows(SnapshotParseException.class,
                () -> parser.parse("[{\"title\": \"A\", \"content\": \"a\", \"scoreCount\": \"many\"}]"));
        assertThrows(SnapshotParseException.class,
                () -> parser.parse("[{\"title\": \"A\", \"content\": \"a\", \"versions\": [{\"content\": \"v\", \"createdAt\": \"yesterday\"}]}]"));
    }
}
