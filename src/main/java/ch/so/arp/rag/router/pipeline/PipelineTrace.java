package ch.so.arp.rag.router.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observability context of a single {@code process} call. Records how long each
 * stage took, how it ended and which degradations occurred. Instances are
 * confined to the thread running the request.
 */
public final class PipelineTrace {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineTrace.class);

    private final String requestId;
    private final long startedAt;
    private final List<StageRecord> stages = new ArrayList<>();
    private final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

    private PipelineTrace(String requestId) {
        this.requestId = requestId;
        this.startedAt = System.nanoTime();
    }

    public static PipelineTrace start() {
        return new PipelineTrace(UUID.randomUUID().toString());
    }

    static PipelineTrace start(String requestId) {
        return new PipelineTrace(requestId);
    }

    public String requestId() {
        return requestId;
    }

    /**
     * Run a stage and record its duration and outcome. Exceptions are recorded
     * and rethrown.
     */
    public <T> T stage(String name, Supplier<T> action) {
        long begin = System.nanoTime();
        try {
            T value = action.get();
            record(name, "ok", begin);
            return value;
        } catch (RuntimeException ex) {
            record(name, "failed (" + ex.getClass().getSimpleName() + ")", begin);
            throw ex;
        }
    }

    public void skip(String name) {
        stages.add(new StageRecord(name, "skipped", 0L));
        LOGGER.debug("[{}] Stage '{}' skipped", requestId, name);
    }

    public void degrade(Degradation degradation, String detail) {
        degradations.add(degradation);
        LOGGER.warn("[{}] {}: {}", requestId, degradation, detail);
    }

    public Set<Degradation> degradations() {
        return Collections.unmodifiableSet(EnumSet.copyOf(degradations));
    }

    public List<StageRecord> stages() {
        return List.copyOf(stages);
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startedAt) / 1_000_000L;
    }

    String summary() {
        return stages.stream().map(StageRecord::toString).collect(Collectors.joining(", "));
    }

    private void record(String name, String outcome, long begin) {
        StageRecord stage = new StageRecord(name, outcome, (System.nanoTime() - begin) / 1_000_000L);
        stages.add(stage);
        LOGGER.debug("[{}] {}", requestId, stage);
    }

    public record StageRecord(String stage, String outcome, long durationMillis) {

        @Override
        public String toString() {
            return stage + "=" + outcome + " in " + durationMillis + " ms";
        }
    }
}
