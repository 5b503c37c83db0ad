package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A custom attribute constructor argument.
 *
 * <p>Scalar arguments carry {@link #value}; array arguments carry {@link #elements} instead.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type","value","elements"})
public final class AttributeArgument {
    /** Full metadata name of the argument type, e.g. {@code System.Boolean[]}. Informational. */
    public final String type;

    /** Boxed scalar value (Boolean, String, Number) or null. */
    public final Object value;

    /** Array elements, or null when the argument is not an array. */
    public final List<AttributeArgument> elements;

    @JsonCreator
    public AttributeArgument(
            @JsonProperty("type") String type,
            @JsonProperty("value") Object value,
            @JsonProperty("elements") List<AttributeArgument> elements
    ) {
        this.type = type;
        this.value = value;
        this.elements = elements == null ? null : List.copyOf(elements);
    }

    public static AttributeArgument ofBoolean(boolean value) {
        return new AttributeArgument("System.Boolean", value, null);
    }

    public static AttributeArgument booleanArray(boolean... values) {
        AttributeArgument[] items = new AttributeArgument[values.length];
        for (int i = 0; i < values.length; i++) items[i] = ofBoolean(values[i]);
        return new AttributeArgument("System.Boolean[]", null, List.of(items));
    }

    @JsonIgnore
    public boolean isArray() {
        return elements != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeArgument)) return false;
        AttributeArgument that = (AttributeArgument) o;
        return Objects.equals(type, that.type) &&
                Objects.equals(value, that.value) &&
                Objects.equals(elements, that.elements);
    }

    @Override public int hashCode() {
        return Objects.hash(type, value, elements);
    }
}
