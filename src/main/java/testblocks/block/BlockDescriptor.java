package testblocks.block;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One step of a pipeline: a block definition plus, optionally, explicit
 * positional arguments for its entry point.
 *
 * <p>A descriptor created without arguments resolves every entry-point
 * parameter through the result store and service registry. A descriptor
 * created with arguments (even an empty list) uses those arguments and
 * nothing else for the entry point.
 */
public final class BlockDescriptor {

    private final BlockDefinition<?> definition;
    private final List<Object>       explicitArgs;

    private BlockDescriptor(BlockDefinition<?> definition, List<Object> explicitArgs) {
        this.definition   = Objects.requireNonNull(definition, "definition");
        this.explicitArgs = explicitArgs;
    }

    public static BlockDescriptor of(BlockDefinition<?> definition) {
        return new BlockDescriptor(definition, null);
    }

    /** Nulls are legal argument values; a null array means "no explicit arguments". */
    public static BlockDescriptor withArgs(BlockDefinition<?> definition, Object... args) {
        if (args == null) {
            return of(definition);
        }
        // null elements are kept: List.copyOf would reject them
        return new BlockDescriptor(definition,
                Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))));
    }

    public BlockDefinition<?> getDefinition() { return definition; }
    public String             getName()       { return definition.getName(); }

    public boolean hasExplicitArgs() {
        return explicitArgs != null;
    }

    /** @return the explicit arguments, or an empty list when none were given */
    public List<Object> getExplicitArgs() {
        return explicitArgs != null ? explicitArgs : Collections.emptyList();
    }

    @Override
    public String toString() {
        return hasExplicitArgs()
                ? String.format("BlockDescriptor{%s, args=%d}", getName(), explicitArgs.size())
                : String.format("BlockDescriptor{%s}", getName());
    }
}
