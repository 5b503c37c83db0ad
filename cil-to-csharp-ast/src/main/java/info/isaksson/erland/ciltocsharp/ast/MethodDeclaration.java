package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A method. A null body (abstract and interface methods) prints as {@code ;}. */
@JsonTypeName("method")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","returnType","modifiers","parameters","body"})
public final class MethodDeclaration implements MemberDeclaration {
    public final String name;
    public final TypeExpression returnType;
    public final Set<Modifier> modifiers;
    public final List<ParameterDeclaration> parameters;
    public final BlockStatement body;

    public MethodDeclaration(String name, TypeExpression returnType, Set<Modifier> modifiers,
                             List<ParameterDeclaration> parameters, BlockStatement body) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = returnType == null ? TypeExpression.nullType() : returnType;
        this.modifiers = Modifiers.copyOf(modifiers);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body;
    }

    @Override public MemberKind memberKind() { return MemberKind.METHOD; }
    @Override public String name() { return name; }
    @Override public Set<Modifier> modifiers() { return modifiers; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MethodDeclaration)) return false;
        MethodDeclaration that = (MethodDeclaration) o;
        return name.equals(that.name) &&
                returnType.equals(that.returnType) &&
                modifiers.equals(that.modifiers) &&
                parameters.equals(that.parameters) &&
                Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, modifiers, parameters, body);
    }
}
