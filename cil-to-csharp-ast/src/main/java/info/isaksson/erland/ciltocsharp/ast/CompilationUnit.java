package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the declaration tree.
 *
 * <p>{@link #members} interleaves namespaces and namespace-less types in order of first
 * appearance.</p>
 */
@JsonPropertyOrder({"usings","members"})
public final class CompilationUnit {
    public final List<UsingDeclaration> usings;
    public final List<UnitMember> members;

    public CompilationUnit(List<UsingDeclaration> usings, List<UnitMember> members) {
        this.usings = usings == null ? List.of() : List.copyOf(usings);
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public CompilationUnit withMembers(List<UnitMember> newMembers) {
        return new CompilationUnit(usings, newMembers);
    }

    public List<NamespaceDeclaration> namespaces() {
        List<NamespaceDeclaration> out = new ArrayList<>();
        for (UnitMember m : members) {
            if (m instanceof NamespaceDeclaration) out.add((NamespaceDeclaration) m);
        }
        return out;
    }

    /** Types placed directly under the root (no namespace). */
    public List<TypeDeclaration> rootTypes() {
        List<TypeDeclaration> out = new ArrayList<>();
        for (UnitMember m : members) {
            if (m instanceof TypeDeclaration) out.add((TypeDeclaration) m);
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompilationUnit)) return false;
        CompilationUnit that = (CompilationUnit) o;
        return usings.equals(that.usings) && members.equals(that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(usings, members);
    }
}
