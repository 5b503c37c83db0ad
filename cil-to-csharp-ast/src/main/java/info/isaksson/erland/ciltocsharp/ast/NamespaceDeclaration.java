package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;

/** {@code namespace a.b { ... }}; {@link #name} is the full dotted namespace. */
@JsonTypeName("namespace")
@JsonPropertyOrder({"name","members"})
public final class NamespaceDeclaration implements UnitMember {
    public final String name;
    public final List<TypeDeclaration> members;

    public NamespaceDeclaration(String name, List<TypeDeclaration> members) {
        this.name = Objects.requireNonNull(name, "name");
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public NamespaceDeclaration withMembers(List<TypeDeclaration> newMembers) {
        return new NamespaceDeclaration(name, newMembers);
    }

    @Override public String name() { return name; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamespaceDeclaration)) return false;
        NamespaceDeclaration that = (NamespaceDeclaration) o;
        return name.equals(that.name) && members.equals(that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(name, members);
    }
}
