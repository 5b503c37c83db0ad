package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.ast.UsingDeclaration;
import info.isaksson.erland.ciltocsharp.metadata.CompiledModule;
import info.isaksson.erland.ciltocsharp.metadata.CompiledType;
import info.isaksson.erland.ciltocsharp.metadata.MetadataNames;

import java.util.List;
import java.util.Objects;

/**
 * Builds the declaration tree of a whole module.
 *
 * <p>Each call to {@link #walk(CompiledModule)} uses a fresh {@link AstBuildContext}; a failure
 * anywhere aborts the run without a result.</p>
 */
public final class ModuleWalker {

    private final MethodBodyReconstructor bodies;

    public ModuleWalker(MethodBodyReconstructor bodies) {
        this.bodies = Objects.requireNonNull(bodies, "bodies");
    }

    public static final class Result {
        public final CompilationUnit unit;
        public final AstBuildStats stats;

        private Result(CompilationUnit unit, AstBuildStats stats) {
            this.unit = unit;
            this.stats = stats;
        }
    }

    public Result walk(CompiledModule module) {
        if (module == null) throw new IllegalArgumentException("module must not be null");

        AstBuildContext ctx = new AstBuildContext();
        TypeBuilder typeBuilder = new TypeBuilder(ctx, new MemberBuilder(ctx, bodies));

        for (CompiledType typeDef : module.types) {
            // Nested types are added by their declaring type.
            if (typeDef.isNested()) {
                ctx.stats.typesSkipped++;
                continue;
            }
            if (MetadataNames.MODULE_TYPE.equals(typeDef.name)) {
                ctx.stats.typesSkipped++;
                continue;
            }
            ctx.addType(typeDef.namespace, typeBuilder.createType(typeDef));
        }

        List<UsingDeclaration> usings = List.of(new UsingDeclaration(TypeExpression.simple(MetadataNames.SYSTEM_NAMESPACE)));
        return new Result(ctx.toCompilationUnit(usings), ctx.stats);
    }
}
