package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","type","parameterModifier"})
public final class ParameterDeclaration {
    public final String name;
    public final TypeExpression type;
    public final ParameterModifier parameterModifier;

    public ParameterDeclaration(String name, TypeExpression type, ParameterModifier parameterModifier) {
        this.name = name;
        this.type = type == null ? TypeExpression.nullType() : type;
        this.parameterModifier = parameterModifier == null ? ParameterModifier.NONE : parameterModifier;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterDeclaration)) return false;
        ParameterDeclaration that = (ParameterDeclaration) o;
        return Objects.equals(name, that.name) && type.equals(that.type) && parameterModifier == that.parameterModifier;
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, parameterModifier);
    }
}
