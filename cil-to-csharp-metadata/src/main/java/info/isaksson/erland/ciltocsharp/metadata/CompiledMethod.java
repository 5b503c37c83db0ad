package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A method definition. Also used as the descriptor handed to the method-body reconstructor.
 *
 * <p>{@code bodyLines} is an optional pre-rendered body carried in module snapshots; metadata
 * readers that reconstruct bodies themselves leave it empty.</p>
 */
@JsonPropertyOrder({"name","access","isStatic","isVirtual","isAbstract","isSpecialName","isRuntimeSpecialName",
        "returnType","returnAttributes","parameters","bodyLines"})
public final class CompiledMethod {
    public final String name;
    public final MemberAccess access;
    public final boolean isStatic;
    public final boolean isVirtual;
    public final boolean isAbstract;
    public final boolean isSpecialName;
    public final boolean isRuntimeSpecialName;

    public final TypeSignature returnType;
    public final List<CustomAttribute> returnAttributes;
    public final List<CompiledParameter> parameters;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> bodyLines;

    @JsonCreator
    public CompiledMethod(
            @JsonProperty("name") String name,
            @JsonProperty("access") MemberAccess access,
            @JsonProperty("isStatic") boolean isStatic,
            @JsonProperty("isVirtual") boolean isVirtual,
            @JsonProperty("isAbstract") boolean isAbstract,
            @JsonProperty("isSpecialName") boolean isSpecialName,
            @JsonProperty("isRuntimeSpecialName") boolean isRuntimeSpecialName,
            @JsonProperty("returnType") TypeSignature returnType,
            @JsonProperty("returnAttributes") List<CustomAttribute> returnAttributes,
            @JsonProperty("parameters") List<CompiledParameter> parameters,
            @JsonProperty("bodyLines") List<String> bodyLines
    ) {
        this.name = name;
        this.access = access == null ? MemberAccess.COMPILER_CONTROLLED : access;
        this.isStatic = isStatic;
        this.isVirtual = isVirtual;
        this.isAbstract = isAbstract;
        this.isSpecialName = isSpecialName;
        this.isRuntimeSpecialName = isRuntimeSpecialName;
        this.returnType = returnType;
        this.returnAttributes = returnAttributes == null ? List.of() : List.copyOf(returnAttributes);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.bodyLines = bodyLines == null ? List.of() : List.copyOf(bodyLines);
    }

    /** Instance constructor or type initializer. */
    @JsonIgnore
    public boolean isConstructor() {
        return isSpecialName && isRuntimeSpecialName
                && (MetadataNames.INSTANCE_CONSTRUCTOR.equals(name) || MetadataNames.TYPE_INITIALIZER.equals(name));
    }

    /** Attribute context of the return value. */
    public MethodReturnType returnParameter() {
        return new MethodReturnType(returnType, returnAttributes);
    }

    @Override public String toString() {
        return returnType + " " + name + parameters;
    }
}
