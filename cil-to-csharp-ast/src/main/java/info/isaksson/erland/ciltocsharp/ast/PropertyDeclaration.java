package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;
import java.util.Set;

@JsonTypeName("property")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","returnType","modifiers","getter","setter"})
public final class PropertyDeclaration implements MemberDeclaration {
    public final String name;
    public final TypeExpression returnType;
    public final Set<Modifier> modifiers;

    /** Null when the property has no get accessor. */
    public final Accessor getter;

    /** Null when the property has no set accessor. */
    public final Accessor setter;

    public PropertyDeclaration(String name, TypeExpression returnType, Set<Modifier> modifiers, Accessor getter, Accessor setter) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = returnType == null ? TypeExpression.nullType() : returnType;
        this.modifiers = Modifiers.copyOf(modifiers);
        this.getter = getter;
        this.setter = setter;
    }

    @Override public MemberKind memberKind() { return MemberKind.PROPERTY; }
    @Override public String name() { return name; }
    @Override public Set<Modifier> modifiers() { return modifiers; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyDeclaration)) return false;
        PropertyDeclaration that = (PropertyDeclaration) o;
        return name.equals(that.name) &&
                returnType.equals(that.returnType) &&
                modifiers.equals(that.modifiers) &&
                Objects.equals(getter, that.getter) &&
                Objects.equals(setter, that.setter);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, modifiers, getter, setter);
    }
}
