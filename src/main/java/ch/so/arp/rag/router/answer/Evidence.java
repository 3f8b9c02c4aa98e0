package ch.so.arp.rag.router.answer;

import java.util.Objects;
import java.util.StringJoiner;

import ch.so.arp.rag.router.retrieval.ContextWindow;

/**
 * Everything the synthesizer may base an answer on: normalized live data text,
 * a context window from retrieval, or both.
 */
public final class Evidence {

    private static final Evidence NONE = new Evidence(null, ContextWindow.empty());

    private final String liveData;
    private final ContextWindow contextWindow;

    private Evidence(String liveData, ContextWindow contextWindow) {
        this.liveData = liveData == null || liveData.isBlank() ? null : liveData;
        this.contextWindow = Objects.requireNonNull(contextWindow, "contextWindow");
    }

    public static Evidence none() {
        return NONE;
    }

    public static Evidence liveData(String text) {
        return new Evidence(text, ContextWindow.empty());
    }

    public static Evidence retrieved(ContextWindow contextWindow) {
        return new Evidence(null, contextWindow);
    }

    public static Evidence combined(String liveData, ContextWindow contextWindow) {
        return new Evidence(liveData, contextWindow);
    }

    public boolean hasLiveData() {
        return liveData != null;
    }

    public String liveData() {
        return liveData;
    }

    public ContextWindow contextWindow() {
        return contextWindow;
    }

    public boolean isEmpty() {
        return liveData == null && contextWindow.isEmpty();
    }

    public String formatForPrompt() {
        StringJoiner joiner = new StringJoiner("\n\n");
        if (liveData != null) {
            joiner.add("[live_data]\n" + liveData.strip());
        }
        if (!contextWindow.isEmpty()) {
            joiner.add(contextWindow.formatForPrompt());
        }
        return joiner.toString();
    }
}
