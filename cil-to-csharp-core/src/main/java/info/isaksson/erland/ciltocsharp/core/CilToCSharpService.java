package info.isaksson.erland.ciltocsharp.core;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.builder.MethodBodyReconstructor;
import info.isaksson.erland.ciltocsharp.builder.ModuleWalker;
import info.isaksson.erland.ciltocsharp.builder.SnapshotBodyReconstructor;
import info.isaksson.erland.ciltocsharp.builder.transform.TransformOrchestrator;
import info.isaksson.erland.ciltocsharp.builder.transform.TransformPasses;
import info.isaksson.erland.ciltocsharp.metadata.CompiledModule;
import info.isaksson.erland.ciltocsharp.metadata.ModuleJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Core API for translating a compiled module into a C# declaration tree and source text.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class CilToCSharpService {

    private final MethodBodyReconstructor bodies;
    private final TransformPasses passes;

    /** Uses bodies carried in module snapshots and leaves the tree unchanged by the passes. */
    public CilToCSharpService() {
        this(new SnapshotBodyReconstructor(), TransformPasses.identity());
    }

    public CilToCSharpService(MethodBodyReconstructor bodies, TransformPasses passes) {
        this.bodies = Objects.requireNonNull(bodies, "bodies");
        this.passes = Objects.requireNonNull(passes, "passes");
    }

    /** Translate a module snapshot file. */
    public CilToCSharpResult translateSnapshot(Path moduleJson, CilToCSharpOptions options) throws IOException {
        if (moduleJson == null) throw new IllegalArgumentException("moduleJson must not be null");
        return translate(ModuleJson.read(moduleJson), options);
    }

    public CilToCSharpResult translate(CompiledModule module, CilToCSharpOptions options) {
        if (module == null) throw new IllegalArgumentException("module must not be null");
        if (options == null) options = new CilToCSharpOptions();

        ModuleWalker.Result built = new ModuleWalker(bodies).walk(module);

        TransformOrchestrator orchestrator = new TransformOrchestrator(options.toSettings(), passes);
        CompilationUnit normalized = orchestrator.run(built.unit);

        String csharp = options.generateCode ? orchestrator.print(normalized) : null;
        return new CilToCSharpResult(normalized, csharp, built.stats);
    }
}
