package info.isaksson.erland.ciltocsharp.builder.transform;

import info.isaksson.erland.ciltocsharp.ast.CSharpPrinter;
import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.ast.FormattingPolicy;
import info.isaksson.erland.ciltocsharp.builder.DecompilerSettings;

import java.util.Objects;

/**
 * Runs the normalization passes over a built tree and prints the result.
 *
 * <p>Schedule: {@code transformIterations} rounds of [dead-label removal if jumps are reduced;
 * idioms, empty-else removal, negation pushing if other reductions are on], then type-reference
 * simplification and one more idioms pass if other reductions are on.</p>
 */
public final class TransformOrchestrator {

    private final DecompilerSettings settings;
    private final TransformPasses passes;

    public TransformOrchestrator(DecompilerSettings settings, TransformPasses passes) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.passes = Objects.requireNonNull(passes, "passes");
    }

    public CompilationUnit run(CompilationUnit unit) {
        Objects.requireNonNull(unit, "unit");
        CompilationUnit current = unit;
        for (int i = 0; i < settings.transformIterations; i++) {
            if (settings.reduceAstJumps) {
                current = passes.removeDeadLabels.apply(current);
            }
            // reduceAstLoops: loop restoration is not available yet.
            if (settings.reduceAstOther) {
                current = passes.idioms.apply(current);
                current = passes.removeEmptyElseBody.apply(current);
                current = passes.pushNegation.apply(current);
            }
        }
        if (settings.reduceAstOther) {
            current = passes.simplifyTypeReferences.apply(current);
            current = passes.idioms.apply(current);
        }
        return current;
    }

    /** Prints a normalized tree without spaces in front of parentheses. */
    public String print(CompilationUnit normalized) {
        return CSharpPrinter.printToString(normalized, FormattingPolicy.decompilerDefault());
    }
}
