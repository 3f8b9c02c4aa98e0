package ch.so.arp.rag.router.classify;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intent of a query, driving which evidence the pipeline collects.
 */
public enum Classification {

    LIVE_DATA("live_data"),
    RETRIEVAL("retrieval"),
    MIXED("mixed"),
    UNCLASSIFIED("unclassified");

    private final String tag;

    Classification(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolve a tag as produced by {@link #tag()}; anything unknown maps to
     * {@link #UNCLASSIFIED}.
     */
    public static Classification fromTag(String value) {
        if (value == null) {
            return UNCLASSIFIED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace("\"", "");
        for (Classification classification : values()) {
            if (classification.tag.equals(normalized)) {
                return classification;
            }
        }
        return UNCLASSIFIED;
    }
}
