package testblocks.block;

/**
 * The single callable a block exposes. The engine hands it the block
 * instance and the positionally resolved arguments.
 *
 * <p>The nested interfaces are the statically typed shapes accepted by
 * {@link BlockDefinition.Builder}; each is adapted to this interface at
 * registration time.
 */
@FunctionalInterface
public interface EntryPoint<B> {

    /**
     * @return the block's result, or {@code null} when it produces nothing
     * @throws Exception anything the block body raises; propagated to the
     *                   caller of the run unchanged
     */
    Object invoke(B block, Object[] args) throws Exception;

    // ── Value-returning shapes ───────────────────────────────────────────

    @FunctionalInterface
    interface Returning0<B, R> {
        R invoke(B block) throws Exception;
    }

    @FunctionalInterface
    interface Returning1<B, A, R> {
        R invoke(B block, A a) throws Exception;
    }

    @FunctionalInterface
    interface Returning2<B, A1, A2, R> {
        R invoke(B block, A1 a1, A2 a2) throws Exception;
    }

    @FunctionalInterface
    interface Returning3<B, A1, A2, A3, R> {
        R invoke(B block, A1 a1, A2 a2, A3 a3) throws Exception;
    }

    // ── Void shapes ──────────────────────────────────────────────────────

    @FunctionalInterface
    interface Void0<B> {
        void invoke(B block) throws Exception;
    }

    @FunctionalInterface
    interface Void1<B, A> {
        void invoke(B block, A a) throws Exception;
    }

    @FunctionalInterface
    interface Void2<B, A1, A2> {
        void invoke(B block, A1 a1, A2 a2) throws Exception;
    }

    @FunctionalInterface
    interface Void3<B, A1, A2, A3> {
        void invoke(B block, A1 a1, A2 a2, A3 a3) throws Exception;
    }
}
