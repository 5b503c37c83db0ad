package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","propertyType","getMethod","setMethod","customAttributes"})
public final class CompiledProperty implements CustomAttributeProvider {
    public final String name;
    public final TypeSignature propertyType;
    public final CompiledMethod getMethod;
    public final CompiledMethod setMethod;
    public final List<CustomAttribute> customAttributes;

    @JsonCreator
    public CompiledProperty(
            @JsonProperty("name") String name,
            @JsonProperty("propertyType") TypeSignature propertyType,
            @JsonProperty("getMethod") CompiledMethod getMethod,
            @JsonProperty("setMethod") CompiledMethod setMethod,
            @JsonProperty("customAttributes") List<CustomAttribute> customAttributes
    ) {
        this.name = name;
        this.propertyType = propertyType;
        this.getMethod = getMethod;
        this.setMethod = setMethod;
        this.customAttributes = customAttributes == null ? List.of() : List.copyOf(customAttributes);
    }

    @Override
    public List<CustomAttribute> customAttributes() {
        return customAttributes;
    }
}
