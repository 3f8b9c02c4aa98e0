package ch.so.arp.rag.router.web;

import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for query requests.
 */
public record QueryRequest(@NotNull String query) {
}
