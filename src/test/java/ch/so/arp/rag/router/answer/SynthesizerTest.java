package ch.so.arp.rag.router.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.router.classify.Classification;
import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.llm.InferenceException;
import ch.so.arp.rag.router.retrieval.ContextItem;
import ch.so.arp.rag.router.retrieval.ContextWindow;
import ch.so.arp.rag.router.retrieval.Provenance;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

class SynthesizerTest {

    private static final GenerationOptions OPTIONS = new GenerationOptions(0.3d, 300);

    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final TimeLimitedExecutor timeLimitedExecutor = new TimeLimitedExecutor(executorService);

    @AfterEach
    void shutdown() {
        executorService.shutdownNow();
    }

    @Test
    void emptyEvidenceGivesFixedAnswerWithoutModel() {
        AtomicInteger calls = new AtomicInteger();
        Synthesizer synthesizer = synthesizer((prompt, options) -> {
            calls.incrementAndGet();
            return "invented";
        }, 6000);

        String answer = synthesizer.synthesize("Summarize the uploaded report", Classification.RETRIEVAL,
                Evidence.none());

        assertThat(answer).isEqualTo(Synthesizer.NO_INFORMATION_ANSWER).startsWith("No information available");
        assertThat(Synthesizer.isNoInformationAnswer(answer)).isTrue();
        assertThat(calls).hasValue(0);
    }

    @Test
    void promptCarriesQueryAndMarkedEvidence() {
        AtomicReference<String> prompt = new AtomicReference<>();
        Synthesizer synthesizer = synthesizer((text, options) -> {
            prompt.set(text);
            return "  Paris is mild today.  ";
        }, 6000);
        ContextWindow window = ContextWindow.assemble(Stream.of(
                new ContextItem("Earlier: Paris was rainy", "4", 0.8d, Provenance.PRIOR_RESPONSE)), 4);

        String answer = synthesizer.synthesize("Weather in Paris and the report?", Classification.MIXED,
                Evidence.combined("Current weather in Paris:\n- Temperature: 18.0°C", window));

        assertThat(answer).isEqualTo("Paris is mild today.");
        assertThat(prompt.get())
                .contains("Question: Weather in Paris and the report?")
                .contains("Question type: mixed")
                .contains("[live_data]\nCurrent weather in Paris:")
                .contains("[prior_response: 4]\nEarlier: Paris was rainy");
    }

    @Test
    void truncatesLongEvidence() {
        AtomicReference<String> prompt = new AtomicReference<>();
        Synthesizer synthesizer = synthesizer((text, options) -> {
            prompt.set(text);
            return "ok";
        }, 20);

        synthesizer.synthesize("q", Classification.LIVE_DATA, Evidence.liveData("x".repeat(500)));

        assertThat(prompt.get()).contains("[evidence truncated]").doesNotContain("x".repeat(30));
    }

    @Test
    void engineFailureIsEngineUnavailable() {
        Synthesizer synthesizer = synthesizer((text, options) -> {
            throw InferenceException.engineUnavailable("HTTP 503", null);
        }, 6000);

        assertThatThrownBy(() -> synthesizer.synthesize("q", Classification.LIVE_DATA, Evidence.liveData("facts")))
                .isInstanceOfSatisfying(SynthesisException.class,
                        ex -> assertThat(ex.getKind().code()).isEqualTo("engine_unavailable"));
    }

    @Test
    void blankCompletionIsEmptyCompletion() {
        Synthesizer synthesizer = synthesizer((text, options) -> " ", 6000);

        assertThatThrownBy(() -> synthesizer.synthesize("q", Classification.LIVE_DATA, Evidence.liveData("facts")))
                .isInstanceOfSatisfying(SynthesisException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(SynthesisException.Kind.EMPTY_COMPLETION));
    }

    @Test
    void slowEngineIsEngineUnavailable() {
        Synthesizer synthesizer = new Synthesizer((text, options) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, timeLimitedExecutor, Duration.ofMillis(50), OPTIONS, 6000);

        assertThatThrownBy(() -> synthesizer.synthesize("q", Classification.LIVE_DATA, Evidence.liveData("facts")))
                .isInstanceOfSatisfying(SynthesisException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(SynthesisException.Kind.ENGINE_UNAVAILABLE));
    }

    private Synthesizer synthesizer(InferenceEngine engine, int maxEvidenceChars) {
        return new Synthesizer(engine, timeLimitedExecutor, Duration.ofSeconds(5), OPTIONS, maxEvidenceChars);
    }
}
