package info.isaksson.erland.ciltocsharp.builder.transform;

import java.util.Objects;

/**
 * The rewrite passes the orchestrator schedules. The rewrite logic itself lives with the
 * statement-level decompiler; {@link #identity()} leaves the tree as built.
 */
public final class TransformPasses {
    public final AstTransform removeDeadLabels;
    public final AstTransform idioms;
    public final AstTransform removeEmptyElseBody;
    public final AstTransform pushNegation;
    public final AstTransform simplifyTypeReferences;

    public TransformPasses(AstTransform removeDeadLabels,
                           AstTransform idioms,
                           AstTransform removeEmptyElseBody,
                           AstTransform pushNegation,
                           AstTransform simplifyTypeReferences) {
        this.removeDeadLabels = Objects.requireNonNull(removeDeadLabels, "removeDeadLabels");
        this.idioms = Objects.requireNonNull(idioms, "idioms");
        this.removeEmptyElseBody = Objects.requireNonNull(removeEmptyElseBody, "removeEmptyElseBody");
        this.pushNegation = Objects.requireNonNull(pushNegation, "pushNegation");
        this.simplifyTypeReferences = Objects.requireNonNull(simplifyTypeReferences, "simplifyTypeReferences");
    }

    public static TransformPasses identity() {
        AstTransform id = AstTransform.identity();
        return new TransformPasses(id, id, id, id, id);
    }
}
