package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A custom attribute applied to a metadata element. */
@JsonPropertyOrder({"attributeType","constructorArguments"})
public final class CustomAttribute {
    /** Full name of the attribute's declaring type, e.g. {@code System.Runtime.CompilerServices.DynamicAttribute}. */
    public final String attributeType;

    public final List<AttributeArgument> constructorArguments;

    @JsonCreator
    public CustomAttribute(
            @JsonProperty("attributeType") String attributeType,
            @JsonProperty("constructorArguments") List<AttributeArgument> constructorArguments
    ) {
        this.attributeType = Objects.requireNonNull(attributeType, "attributeType must not be null");
        this.constructorArguments = constructorArguments == null ? List.of() : List.copyOf(constructorArguments);
    }

    public static CustomAttribute of(String attributeType, AttributeArgument... arguments) {
        return new CustomAttribute(attributeType, List.of(arguments));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CustomAttribute)) return false;
        CustomAttribute that = (CustomAttribute) o;
        return attributeType.equals(that.attributeType) &&
                constructorArguments.equals(that.constructorArguments);
    }

    @Override public int hashCode() {
        return Objects.hash(attributeType, constructorArguments);
    }

    @Override public String toString() {
        return attributeType + constructorArguments;
    }
}
