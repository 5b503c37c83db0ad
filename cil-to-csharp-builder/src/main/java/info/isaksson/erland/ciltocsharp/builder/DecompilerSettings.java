package info.isaksson.erland.ciltocsharp.builder;

/** Switches for the tree normalization passes. */
public final class DecompilerSettings {
    /** Enables dead-label removal. */
    public boolean reduceAstJumps = true;

    /** Reserved for loop restoration; currently has no effect. */
    public boolean reduceAstLoops = true;

    /** Enables idiom simplification, empty-else removal, negation pushing and type-reference simplification. */
    public boolean reduceAstOther = true;

    /**
     * Rounds of the main pass loop. Chosen empirically; passes are not run to a fixed point, so a
     * second orchestrator run over its own output may still change the tree.
     */
    public int transformIterations = 4;
}
