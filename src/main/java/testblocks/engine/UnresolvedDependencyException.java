package testblocks.engine;

import testblocks.model.TypeKey;

/**
 * Thrown when no resolution tier can supply a value a block requires.
 */
public class UnresolvedDependencyException extends TestFrameworkException {

    private final TypeKey<?> missingKey;
    private final String     blockName;

    public UnresolvedDependencyException(TypeKey<?> missingKey, String blockName, String detail) {
        this(missingKey, blockName, detail, null);
    }

    public UnresolvedDependencyException(TypeKey<?> missingKey, String blockName,
                                         String detail, Throwable cause) {
        super("Unable to resolve " + missingKey + " for test block '" + blockName + "'"
                + (detail != null ? ": " + detail : ""), cause);
        this.missingKey = missingKey;
        this.blockName  = blockName;
    }

    public TypeKey<?> getMissingKey() { return missingKey; }
    public String     getBlockName()  { return blockName; }
}
