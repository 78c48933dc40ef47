package com.promptvault.service;

import com.promptvault.StoreIntegrationTestSupport;
import com.promptvault.entity.PromptEntity;
import com.promptvault.model.dto.PromptDetail;
import com.promptvault.model.dto.TagSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PromptQueryService: search, tag filter, sort modes and tag counts.
 */
class PromptQueryServiceTest extends StoreIntegrationTestSupport {

    private static final OffsetDateTime BASE = OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private PromptQueryService queryService;

    @Autowired
    private PromptService promptService;

    @Test
    void testListWithoutFiltersReturnsAll() {
        promptService.create("a", "alpha", List.of(), false, null);
        promptService.create("b", "beta", List.of(), false, null);

        assertEquals(2, queryService.list(null, null, null).size());
        assertEquals(2, queryService.list("   ", "  ", "").size());
    }

    @Test
    void testSearchMatchesTitleContentAndTags() {
        promptService.create("Email writer", "Draft a reply", List.of(), false, null);
        promptService.create("Other", "Write an EMAIL politely", List.of(), false, null);
        promptService.create("Third", "Nothing here", List.of("email-templates"), false, null);
        promptService.create("Unrelated", "No match", List.of("misc"), false, null);

        List<String> titles = titles(queryService.list("email", null, null));

        assertEquals(3, titles.size());
        assertFalse(titles.contains("Unrelated"));
    }

    @Test
    void testSearchTreatsWildcardsLiterally() {
        promptService.create("Discount", "Take 50% off", List.of(), false, null);
        promptService.create("Plain", "Take 500 off", List.of(), false, null);
        promptService.create("Snake", "use snake_case names", List.of(), false, null);
        promptService.create("Camel", "use snakeXcase names", List.of(), false, null);

        assertEquals(List.of("Discount"), titles(queryService.list("50%", null, null)));
        assertEquals(List.of("Snake"), titles(queryService.list("snake_case", null, null)));
    }

    @Test
    void testTagFilterMatchesWholeTagOnly() {
        promptService.create("ml only", "c", List.of("ai-ml"), false, null);
        promptService.create("ai", "c", List.of("AI", "writing"), false, null);

        assertEquals(List.of("ai"), titles(queryService.list(null, "ai", null)));
        assertEquals(List.of("ml only"), titles(queryService.list(null, "ai-ml", null)));
        assertTrue(queryService.list(null, "ml", null).isEmpty());
    }

    @Test
    void testSearchAndTagFilterCombine() {
        promptService.create("Blog intro", "Write an intro", List.of("writing"), false, null);
        promptService.create("Blog outro", "Write an outro", List.of("editing"), false, null);
        promptService.create("Poem", "Write a poem", List.of("writing"), false, null);

        assertEquals(List.of("Blog intro"), titles(queryService.list("Blog", "writing", null)));
    }

    @Test
    void testSortByUpdatedIsDefault() {
        PromptDetail older = promptService.create("older", "c", List.of(), false, null);
        PromptDetail newer = promptService.create("newer", "c", List.of(), false, null);
        setTimestamps(older.getId(), BASE, BASE.plusHours(2), null);
        setTimestamps(newer.getId(), BASE.plusHours(1), BASE.plusHours(1), null);

        assertEquals(List.of("older", "newer"), titles(queryService.list(null, null, null)));
        assertEquals(List.of("older", "newer"), titles(queryService.list(null, null, "whatever")));
    }

    @Test
    void testSortByCreated() {
        PromptDetail first = promptService.create("first", "c", List.of(), false, null);
        PromptDetail second = promptService.create("second", "c", List.of(), false, null);
        setTimestamps(first.getId(), BASE, BASE.plusHours(5), null);
        setTimestamps(second.getId(), BASE.plusHours(1), BASE.plusHours(1), null);

        assertEquals(List.of("second", "first"), titles(queryService.list(null, null, "created")));
    }

    @Test
    void testSortByScoreThenUpdated() {
        PromptDetail low = promptService.create("low", "c", List.of(), false, null);
        PromptDetail highOld = promptService.create("high old", "c", List.of(), false, null);
        PromptDetail highNew = promptService.create("high new", "c", List.of(), false, null);
        setTimestamps(low.getId(), BASE, BASE.plusHours(9), 2.0);
        setTimestamps(highOld.getId(), BASE, BASE.plusHours(1), 4.5);
        setTimestamps(highNew.getId(), BASE, BASE.plusHours(2), 4.5);

        assertEquals(List.of("high new", "high old", "low"), titles(queryService.list(null, null, "score")));
    }

    @Test
    void testListTagsCountsAndOrders() {
        promptService.create("1", "c", List.of("writing", "ai"), false, null);
        promptService.create("2", "c", List.of("ai", "code"), false, null);
        promptService.create("3", "c", List.of("AI", "blog"), false, null);
        promptService.create("4", "c", List.of(), false, null);

        List<TagSummary> tags = queryService.listTags();

        assertEquals("ai", tags.get(0).getName());
        assertEquals(2L, tags.get(0).getCount());
        assertEquals(List.of("AI", "blog", "code", "writing"),
                tags.subList(1, tags.size()).stream().map(TagSummary::getName).collect(Collectors.toList()));
        assertTrue(tags.subList(1, tags.size()).stream().allMatch(t -> t.getCount() == 1L));
    }

    @Test
    void testListTagsOnEmptyStore() {
        assertTrue(queryService.listTags().isEmpty());
    }

    private void setTimestamps(Long id, OffsetDateTime createdAt, OffsetDateTime updatedAt, Double scoreAvg) {
        PromptEntity entity = promptRepository.findById(id).orElseThrow();
        entity.setCreatedAt(createdAt);
        entity.setUpdatedAt(updatedAt);
        if (scoreAvg != null) {
            entity.setScoreAvg(scoreAvg);
            entity.setScoreCount(1L);
        }
        promptRepository.save(entity);
    }

    private static List<String> titles(List<PromptDetail> prompts) {
        return prompts.stream().map(PromptDetail::getTitle).collect(Collectors.toList());
    }
}
