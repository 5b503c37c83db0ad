package info.isaksson.erland.ciltocsharp.ast;

import java.util.Objects;

/** {@code using X;} */
public final class UsingDeclaration {
    public final TypeExpression importTarget;

    public UsingDeclaration(TypeExpression importTarget) {
        this.importTarget = Objects.requireNonNull(importTarget, "importTarget");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UsingDeclaration)) return false;
        return importTarget.equals(((UsingDeclaration) o).importTarget);
    }

    @Override public int hashCode() {
        return importTarget.hashCode();
    }
}
