package com.promptvault.model.snapshot;

import java.util.List;

/**
 * The two accepted snapshot shapes, resolved once at parse time:
 * an object wrapping a {@code prompts} list, or a bare list of prompt items.
 * Downstream code only sees {@link #getItems()}.
 */
public abstract class ImportPayload {

    private final List<ImportPromptItem> items;

    protected ImportPayload(List<ImportPromptItem> items) {
        this.items = List.copyOf(items);
    }

    public List<ImportPromptItem> getItems() {
        return items;
    }

    /**
     * {@code { "exportedAt": ..., "prompts": [ ... ] }}
     */
    public static final class Wrapped extends ImportPayload {
        public Wrapped(List<ImportPromptItem> items) {
            super(items);
        }
    }

    /**
     * {@code [ ... ]}
     */
    public static final class Flat extends ImportPayload {
        public Flat(List<ImportPromptItem> items) {
            super(items);
        }
    }
}
