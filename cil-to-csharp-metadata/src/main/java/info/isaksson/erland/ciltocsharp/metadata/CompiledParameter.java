package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name","parameterType","isIn","isOut","customAttributes"})
public final class CompiledParameter implements CustomAttributeProvider {
    public final String name;
    public final TypeSignature parameterType;

    /** {@code [in]} flag. */
    public final boolean isIn;

    /** {@code [out]} flag. */
    public final boolean isOut;

    public final List<CustomAttribute> customAttributes;

    @JsonCreator
    public CompiledParameter(
            @JsonProperty("name") String name,
            @JsonProperty("parameterType") TypeSignature parameterType,
            @JsonProperty("isIn") boolean isIn,
            @JsonProperty("isOut") boolean isOut,
            @JsonProperty("customAttributes") List<CustomAttribute> customAttributes
    ) {
        this.name = name;
        this.parameterType = parameterType;
        this.isIn = isIn;
        this.isOut = isOut;
        this.customAttributes = customAttributes == null ? List.of() : List.copyOf(customAttributes);
    }

    public static CompiledParameter of(String name, TypeSignature type) {
        return new CompiledParameter(name, type, false, false, null);
    }

    @Override
    public List<CustomAttribute> customAttributes() {
        return customAttributes;
    }

    @Override public String toString() {
        return parameterType + " " + name;
    }
}
