package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.ast.NamespaceDeclaration;
import info.isaksson.erland.ciltocsharp.ast.TypeDeclaration;
import info.isaksson.erland.ciltocsharp.ast.UnitMember;
import info.isaksson.erland.ciltocsharp.ast.UsingDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one module translation run: the namespace registry and build counters.
 *
 * <p>Root entries keep first-seen order: a namespace takes its position when its first type is
 * added; namespace-less types take theirs when added. Never reuse a context across runs.</p>
 */
public final class AstBuildContext {

    public final AstBuildStats stats = new AstBuildStats();

    private final Map<String, List<TypeDeclaration>> typesByNamespace = new LinkedHashMap<>();
    private final List<RootEntry> rootEntries = new ArrayList<>();

    /** Attach a top-level type under its namespace, or under the root when the namespace is empty. */
    public void addType(String namespace, TypeDeclaration type) {
        if (namespace == null || namespace.isEmpty()) {
            rootEntries.add(RootEntry.ofType(type));
            return;
        }
        getOrCreateNamespace(namespace).add(type);
    }

    private List<TypeDeclaration> getOrCreateNamespace(String name) {
        List<TypeDeclaration> existing = typesByNamespace.get(name);
        if (existing != null) return existing;
        List<TypeDeclaration> created = new ArrayList<>();
        typesByNamespace.put(name, created);
        rootEntries.add(RootEntry.ofNamespace(name));
        stats.namespacesCreated++;
        return created;
    }

    public CompilationUnit toCompilationUnit(List<UsingDeclaration> usings) {
        List<UnitMember> members = new ArrayList<>(rootEntries.size());
        for (RootEntry e : rootEntries) {
            if (e.namespace != null) {
                members.add(new NamespaceDeclaration(e.namespace, typesByNamespace.get(e.namespace)));
            } else {
                members.add(e.type);
            }
        }
        return new CompilationUnit(usings, members);
    }

    private static final class RootEntry {
        final String namespace;
        final TypeDeclaration type;

        private RootEntry(String namespace, TypeDeclaration type) {
            this.namespace = namespace;
            this.type = type;
        }

        static RootEntry ofNamespace(String namespace) {
            return new RootEntry(namespace, null);
        }

        static RootEntry ofType(TypeDeclaration type) {
            return new RootEntry(null, type);
        }
    }
}
