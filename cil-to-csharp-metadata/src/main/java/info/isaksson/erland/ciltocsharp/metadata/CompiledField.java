package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name","fieldType","access","isStatic","isLiteral","customAttributes"})
public final class CompiledField implements CustomAttributeProvider {
    public final String name;
    public final TypeSignature fieldType;
    public final MemberAccess access;
    public final boolean isStatic;

    /** Compile-time constant ({@code const} in C#). */
    public final boolean isLiteral;

    public final List<CustomAttribute> customAttributes;

    @JsonCreator
    public CompiledField(
            @JsonProperty("name") String name,
            @JsonProperty("fieldType") TypeSignature fieldType,
            @JsonProperty("access") MemberAccess access,
            @JsonProperty("isStatic") boolean isStatic,
            @JsonProperty("isLiteral") boolean isLiteral,
            @JsonProperty("customAttributes") List<CustomAttribute> customAttributes
    ) {
        this.name = name;
        this.fieldType = fieldType;
        this.access = access == null ? MemberAccess.COMPILER_CONTROLLED : access;
        this.isStatic = isStatic;
        this.isLiteral = isLiteral;
        this.customAttributes = customAttributes == null ? List.of() : List.copyOf(customAttributes);
    }

    @Override
    public List<CustomAttribute> customAttributes() {
        return customAttributes;
    }

    @Override public String toString() {
        return fieldType + " " + name;
    }
}
