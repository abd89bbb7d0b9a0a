package testblocks.engine;

import testblocks.model.TypeKey;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable summary of a successful run. A failed run never produces one:
 * {@link TestBuilder#run()} rethrows the failure instead.
 */
public final class RunResult {

    private final String                  runName;
    private final List<BlockRecord>       blocks;
    private final Map<TypeKey<?>, Object> finalResults;
    private final Duration                duration;

    public RunResult(String runName, List<BlockRecord> blocks,
                     Map<TypeKey<?>, Object> finalResults, Duration duration) {
        this.runName      = runName;
        this.blocks       = Collections.unmodifiableList(blocks);
        this.finalResults = finalResults;
        this.duration     = duration;
    }

    public String            getRunName()  { return runName; }
    public List<BlockRecord> getBlocks()   { return blocks; }
    public Duration          getDuration() { return duration; }

    /** Result store contents at the end of the run. */
    public Map<TypeKey<?>, Object> getFinalResults() { return finalResults; }

    /** The last value produced under {@code key}, if any block produced one. */
    public <T> Optional<T> getResult(TypeKey<T> key) {
        Object value = finalResults.get(key);
        return value == null ? Optional.empty() : Optional.of(key.cast(value));
    }

    @Override
    public String toString() {
        return String.format("RunResult{%s, %d block(s) in %dms}", runName, blocks.size(), duration.toMillis());
    }
}
