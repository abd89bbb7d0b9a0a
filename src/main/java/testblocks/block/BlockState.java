package testblocks.block;

/**
 * Lifecycle of one block within a run.
 *
 * <pre>
 * PENDING → RESOLVING → INSTANTIATED → INVOKING → COMPLETED
 *               ↘             ↘            ↘
 *                 FAILED        FAILED       FAILED
 * </pre>
 */
public enum BlockState {
    PENDING,
    RESOLVING,
    INSTANTIATED,
    INVOKING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
