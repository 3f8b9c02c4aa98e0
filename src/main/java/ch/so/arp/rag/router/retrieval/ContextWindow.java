package ch.so.arp.rag.router.retrieval;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, bounded set of context items assembled for one synthesis. Items are
 * kept most relevant first; the window never changes after assembly.
 */
public final class ContextWindow {

    private static final ContextWindow EMPTY = new ContextWindow(List.of());

    private final List<ContextItem> items;

    private ContextWindow(List<ContextItem> items) {
        this.items = List.copyOf(items);
    }

    public static ContextWindow empty() {
        return EMPTY;
    }

    /**
     * Drain up to {@code maxItems} items from the retrieval stream.
     */
    public static ContextWindow assemble(Stream<ContextItem> items, int maxItems) {
        try (items) {
            return new ContextWindow(items.limit(Math.max(0, maxItems)).toList());
        }
    }

    public List<ContextItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public String formatForPrompt() {
        return items.stream().map(ContextItem::formatForPrompt).collect(Collectors.joining("\n\n"));
    }

    @Override
    public String toString() {
        return "ContextWindow" + items;
    }
}
