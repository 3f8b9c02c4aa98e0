package ch.so.arp.rag.router;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * A natural-language query as it entered the pipeline.
 */
public record Query(String text, Instant receivedAt) {

    public Query {
        text = text == null ? "" : text;
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public static Query of(String text) {
        return of(text, Clock.systemUTC());
    }

    public static Query of(String text, Clock clock) {
        return new Query(text, clock.instant());
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
