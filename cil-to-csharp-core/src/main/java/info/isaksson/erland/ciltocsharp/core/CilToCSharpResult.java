package info.isaksson.erland.ciltocsharp.core;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.builder.AstBuildStats;

/** Translation result container for programmatic usage. */
public final class CilToCSharpResult {
    /** Tree after the normalization passes. */
    public final CompilationUnit unit;

    /** C# source text; null when code generation was switched off. */
    public final String csharp;

    public final AstBuildStats stats;

    CilToCSharpResult(CompilationUnit unit, String csharp, AstBuildStats stats) {
        this.unit = unit;
        this.csharp = csharp;
        this.stats = stats;
    }
}
