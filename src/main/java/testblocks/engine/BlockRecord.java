package testblocks.engine;

import testblocks.block.BlockState;

import java.time.Duration;

/**
 * Outcome of one block in a completed run.
 */
public final class BlockRecord {

    private final int        index;
    private final String     blockName;
    private final BlockState state;
    private final Duration   duration;

    public BlockRecord(int index, String blockName, BlockState state, Duration duration) {
        this.index     = index;
        this.blockName = blockName;
        this.state     = state;
        this.duration  = duration;
    }

    /** Zero-based position in the pipeline. */
    public int        getIndex()     { return index; }
    public String     getBlockName() { return blockName; }
    public BlockState getState()     { return state; }
    public Duration   getDuration()  { return duration; }

    @Override
    public String toString() {
        return String.format("BlockRecord{#%d %s %s in %dms}", index, blockName, state, duration.toMillis());
    }
}
