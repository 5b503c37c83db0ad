package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","eventType","addMethod","removeMethod","customAttributes"})
public final class CompiledEvent implements CustomAttributeProvider {
    public final String name;
    public final TypeSignature eventType;
    public final CompiledMethod addMethod;
    public final CompiledMethod removeMethod;
    public final List<CustomAttribute> customAttributes;

    @JsonCreator
    public CompiledEvent(
            @JsonProperty("name") String name,
            @JsonProperty("eventType") TypeSignature eventType,
            @JsonProperty("addMethod") CompiledMethod addMethod,
            @JsonProperty("removeMethod") CompiledMethod removeMethod,
            @JsonProperty("customAttributes") List<CustomAttribute> customAttributes
    ) {
        this.name = name;
        this.eventType = eventType;
        this.addMethod = addMethod;
        this.removeMethod = removeMethod;
        this.customAttributes = customAttributes == null ? List.of() : List.copyOf(customAttributes);
    }

    @Override
    public List<CustomAttribute> customAttributes() {
        return customAttributes;
    }
}
