package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;
import java.util.Set;

/** A field declaration; no initializer is reconstructed. */
@JsonTypeName("field")
@JsonPropertyOrder({"name","returnType","modifiers"})
public final class FieldDeclaration implements MemberDeclaration {
    public final String name;
    public final TypeExpression returnType;
    public final Set<Modifier> modifiers;

    public FieldDeclaration(String name, TypeExpression returnType, Set<Modifier> modifiers) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = returnType == null ? TypeExpression.nullType() : returnType;
        this.modifiers = Modifiers.copyOf(modifiers);
    }

    @Override public MemberKind memberKind() { return MemberKind.FIELD; }
    @Override public String name() { return name; }
    @Override public Set<Modifier> modifiers() { return modifiers; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldDeclaration)) return false;
        FieldDeclaration that = (FieldDeclaration) o;
        return name.equals(that.name) && returnType.equals(that.returnType) && modifiers.equals(that.modifiers);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, modifiers);
    }
}
