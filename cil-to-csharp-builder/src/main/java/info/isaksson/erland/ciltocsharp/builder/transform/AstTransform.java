package info.isaksson.erland.ciltocsharp.builder.transform;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;

/** A whole-tree rewrite. Returns the rewritten tree; the input is left untouched. */
@FunctionalInterface
public interface AstTransform {

    CompilationUnit apply(CompilationUnit unit);

    static AstTransform identity() {
        return unit -> unit;
    }
}
