package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * A type definition read from module metadata.
 *
 * <p>Nested types are owned by their declaring type ({@link #nestedTypes}). Each nested type's
 * {@link #declaringTypeName} is set to its owner's {@link #fullName()}, at every nesting level.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"namespace","name","declaringTypeName","visibility","isAbstract","isInterface","isValueType","isEnum",
        "baseType","interfaces","nestedTypes","fields","properties","events","methods"})
public final class CompiledType {
    public final String namespace;
    public final String name;

    /** Full name of the enclosing type; null for top-level types. */
    public final String declaringTypeName;

    public final TypeVisibility visibility;
    public final boolean isAbstract;
    public final boolean isInterface;
    public final boolean isValueType;
    public final boolean isEnum;

    public final TypeSignature baseType;
    public final List<TypeSignature> interfaces;

    public final List<CompiledType> nestedTypes;
    public final List<CompiledField> fields;
    public final List<CompiledProperty> properties;
    public final List<CompiledEvent> events;
    public final List<CompiledMethod> methods;

    @JsonCreator
    public CompiledType(
            @JsonProperty("namespace") String namespace,
            @JsonProperty("name") String name,
            @JsonProperty("declaringTypeName") String declaringTypeName,
            @JsonProperty("visibility") TypeVisibility visibility,
            @JsonProperty("isAbstract") boolean isAbstract,
            @JsonProperty("isInterface") boolean isInterface,
            @JsonProperty("isValueType") boolean isValueType,
            @JsonProperty("isEnum") boolean isEnum,
            @JsonProperty("baseType") TypeSignature baseType,
            @JsonProperty("interfaces") List<TypeSignature> interfaces,
            @JsonProperty("nestedTypes") List<CompiledType> nestedTypes,
            @JsonProperty("fields") List<CompiledField> fields,
            @JsonProperty("properties") List<CompiledProperty> properties,
            @JsonProperty("events") List<CompiledEvent> events,
            @JsonProperty("methods") List<CompiledMethod> methods
    ) {
        this.namespace = namespace == null ? "" : namespace;
        this.name = name;
        this.declaringTypeName = declaringTypeName;
        this.visibility = visibility == null ? TypeVisibility.NOT_PUBLIC : visibility;
        this.isAbstract = isAbstract;
        this.isInterface = isInterface;
        this.isValueType = isValueType;
        this.isEnum = isEnum;
        this.baseType = baseType;
        this.interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        this.nestedTypes = nestedTypes == null ? List.of() : linkNested(nestedTypes, fullName());
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.events = events == null ? List.of() : List.copyOf(events);
        this.methods = methods == null ? List.of() : List.copyOf(methods);
    }

    private static List<CompiledType> linkNested(List<CompiledType> nested, String ownerName) {
        List<CompiledType> out = new ArrayList<>(nested.size());
        for (CompiledType t : nested) {
            if (t == null) continue;
            out.add(ownerName.equals(t.declaringTypeName) ? t : t.withDeclaringTypeName(ownerName));
        }
        return List.copyOf(out);
    }

    public CompiledType withDeclaringTypeName(String declaringTypeName) {
        return new CompiledType(namespace, name, declaringTypeName, visibility, isAbstract, isInterface, isValueType, isEnum,
                baseType, interfaces, nestedTypes, fields, properties, events, methods);
    }

    @JsonIgnore
    public boolean isNested() {
        return declaringTypeName != null;
    }

    /** Metadata full name; nested types use {@code Outer/Inner}. */
    public String fullName() {
        if (declaringTypeName != null) return declaringTypeName + "/" + name;
        return namespace.isEmpty() ? String.valueOf(name) : namespace + "." + name;
    }

    @Override public String toString() {
        return fullName();
    }

    /** Fluent construction for tests and metadata adapters. */
    public static Builder builder(String namespace, String name) {
        return new Builder(namespace, name);
    }

    public static final class Builder {
        private final String namespace;
        private final String name;
        private TypeVisibility visibility = TypeVisibility.PUBLIC;
        private boolean isAbstract;
        private boolean isInterface;
        private boolean isValueType;
        private boolean isEnum;
        private TypeSignature baseType = TypeSignature.named(MetadataNames.SYSTEM_NAMESPACE, MetadataNames.OBJECT);
        private final List<TypeSignature> interfaces = new ArrayList<>();
        private final List<CompiledType> nestedTypes = new ArrayList<>();
        private final List<CompiledField> fields = new ArrayList<>();
        private final List<CompiledProperty> properties = new ArrayList<>();
        private final List<CompiledEvent> events = new ArrayList<>();
        private final List<CompiledMethod> methods = new ArrayList<>();

        private Builder(String namespace, String name) {
            this.namespace = namespace;
            this.name = name;
        }

        public Builder visibility(TypeVisibility v) { this.visibility = v; return this; }
        public Builder isAbstract(boolean v) { this.isAbstract = v; return this; }
        public Builder isInterface(boolean v) { this.isInterface = v; return this; }
        public Builder isValueType(boolean v) { this.isValueType = v; return this; }
        public Builder isEnum(boolean v) { this.isEnum = v; return this; }
        public Builder baseType(TypeSignature v) { this.baseType = v; return this; }
        public Builder addInterface(TypeSignature v) { this.interfaces.add(v); return this; }
        public Builder addNestedType(CompiledType v) { this.nestedTypes.add(v); return this; }
        public Builder addField(CompiledField v) { this.fields.add(v); return this; }
        public Builder addProperty(CompiledProperty v) { this.properties.add(v); return this; }
        public Builder addEvent(CompiledEvent v) { this.events.add(v); return this; }
        public Builder addMethod(CompiledMethod v) { this.methods.add(v); return this; }

        public CompiledType build() {
            return new CompiledType(namespace, name, null, visibility, isAbstract, isInterface, isValueType, isEnum,
                    baseType, interfaces, nestedTypes, fields, properties, events, methods);
        }
    }
}
