package ch.so.arp.rag.router.evaluation;

import jakarta.validation.constraints.NotNull;

public record EvaluationRequest(@NotNull String query, @NotNull String response) {
}
