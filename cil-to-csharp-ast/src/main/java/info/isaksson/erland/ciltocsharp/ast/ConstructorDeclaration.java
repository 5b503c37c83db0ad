package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Instance constructor or static type initializer. {@link #name} is the declaring type's name. */
@JsonTypeName("constructor")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","modifiers","parameters","body"})
public final class ConstructorDeclaration implements MemberDeclaration {
    public final String name;
    public final Set<Modifier> modifiers;
    public final List<ParameterDeclaration> parameters;
    public final BlockStatement body;

    public ConstructorDeclaration(String name, Set<Modifier> modifiers, List<ParameterDeclaration> parameters, BlockStatement body) {
        this.name = Objects.requireNonNull(name, "name");
        this.modifiers = Modifiers.copyOf(modifiers);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body;
    }

    @Override public MemberKind memberKind() { return MemberKind.CONSTRUCTOR; }
    @Override public String name() { return name; }
    @Override public Set<Modifier> modifiers() { return modifiers; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstructorDeclaration)) return false;
        ConstructorDeclaration that = (ConstructorDeclaration) o;
        return name.equals(that.name) &&
                modifiers.equals(that.modifiers) &&
                parameters.equals(that.parameters) &&
                Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(name, modifiers, parameters, body);
    }
}
