package ch.so.arp.rag.router.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.rag.router.llm.GenerationOptions;
import ch.so.arp.rag.router.llm.InferenceEngine;
import ch.so.arp.rag.router.llm.InferenceException;
import ch.so.arp.rag.router.support.StageTimeoutException;
import ch.so.arp.rag.router.support.TimeLimitedExecutor;

class EnhancerTest {

    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final TimeLimitedExecutor timeLimitedExecutor = new TimeLimitedExecutor(executorService);

    @AfterEach
    void shutdown() {
        executorService.shutdownNow();
    }

    @Test
    void returnsRefinedAnswer() {
        AtomicReference<String> prompt = new AtomicReference<>();
        Enhancer enhancer = enhancer((text, options) -> {
            prompt.set(text);
            return "Paris: 18 °C, sunny.\n";
        });

        assertThat(enhancer.enhance("paris 18 degrees sunny")).isEqualTo("Paris: 18 °C, sunny.");
        assertThat(prompt.get()).contains("Do not add facts").endsWith("paris 18 degrees sunny\n");
    }

    @Test
    void engineFailureRaisesEnhancementException() {
        Enhancer enhancer = enhancer((text, options) -> {
            throw InferenceException.engineUnavailable("down", null);
        });

        assertThatThrownBy(() -> enhancer.enhance("draft"))
                .isInstanceOf(EnhancementException.class)
                .hasCauseInstanceOf(InferenceException.class);
    }

    @Test
    void blankResultRaisesEnhancementException() {
        assertThatThrownBy(() -> enhancer((text, options) -> "").enhance("draft"))
                .isInstanceOf(EnhancementException.class);
    }

    @Test
    void slowEngineRaisesEnhancementException() {
        Enhancer enhancer = new Enhancer((text, options) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, timeLimitedExecutor, Duration.ofMillis(50), new GenerationOptions(0.3d, 400));

        assertThatThrownBy(() -> enhancer.enhance("draft"))
                .isInstanceOf(EnhancementException.class)
                .hasCauseInstanceOf(StageTimeoutException.class);
    }

    private Enhancer enhancer(InferenceEngine engine) {
        return new Enhancer(engine, timeLimitedExecutor, Duration.ofSeconds(5), new GenerationOptions(0.3d, 400));
    }
}
