package info.isaksson.erland.ciltocsharp.core;

import info.isaksson.erland.ciltocsharp.builder.DecompilerSettings;

/**
 * Core (server-friendly) options for cil-to-csharp translation.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class CilToCSharpOptions {
    public boolean reduceAstJumps = true;
    public boolean reduceAstLoops = true;
    public boolean reduceAstOther = true;
    public int transformIterations = 4;

    /** When false the tree is returned as built and no C# text is produced. */
    public boolean generateCode = true;

    DecompilerSettings toSettings() {
        DecompilerSettings s = new DecompilerSettings();
        s.reduceAstJumps = reduceAstJumps;
        s.reduceAstLoops = reduceAstLoops;
        s.reduceAstOther = reduceAstOther;
        s.transformIterations = transformIterations;
        return s;
    }
}
