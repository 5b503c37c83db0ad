package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Compiled encoding of a type reference, as read from module metadata.
 *
 * <p>A missing type reference is represented by {@code null}, not by an instance of this class.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind","namespace","name","declaringType","elementType","modifierType","genericArguments","rank"})
public final class TypeSignature {
    public final SignatureKind kind;

    /** For NAMED. Empty for types in the global namespace. */
    public final String namespace;

    /** For NAMED, NESTED and GENERIC_PARAMETER. Raw metadata name (may carry an arity suffix). */
    public final String name;

    /** For NESTED: the enclosing type. */
    public final TypeSignature declaringType;

    /** For every wrapper kind (modifiers, by-reference, pointer, array, generic instance). */
    public final TypeSignature elementType;

    /** For OPTIONAL_MODIFIER/REQUIRED_MODIFIER: the modifier type itself. Never rendered. */
    public final TypeSignature modifierType;

    /** For GENERIC_INSTANCE. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<TypeSignature> genericArguments;

    /** For ARRAY: number of dimensions, at least 1. */
    public final Integer rank;

    @JsonCreator
    public TypeSignature(
            @JsonProperty("kind") SignatureKind kind,
            @JsonProperty("namespace") String namespace,
            @JsonProperty("name") String name,
            @JsonProperty("declaringType") TypeSignature declaringType,
            @JsonProperty("elementType") TypeSignature elementType,
            @JsonProperty("modifierType") TypeSignature modifierType,
            @JsonProperty("genericArguments") List<TypeSignature> genericArguments,
            @JsonProperty("rank") Integer rank
    ) {
        if (kind == null) throw new IllegalArgumentException("signature kind must not be null");
        this.kind = kind;
        this.namespace = kind == SignatureKind.NAMED && namespace == null ? "" : namespace;
        this.name = name;
        this.declaringType = declaringType;
        this.elementType = elementType;
        this.modifierType = modifierType;
        this.genericArguments = genericArguments == null ? List.of() : List.copyOf(genericArguments);
        if (kind == SignatureKind.ARRAY) {
            int r = rank == null ? 1 : rank;
            if (r < 1) throw new IllegalArgumentException("array rank must be >= 1: " + r);
            this.rank = r;
        } else {
            this.rank = null;
        }
    }

    public static TypeSignature named(String namespace, String name) {
        return new TypeSignature(SignatureKind.NAMED, namespace, name, null, null, null, null, null);
    }

    public static TypeSignature nested(TypeSignature declaringType, String name) {
        return new TypeSignature(SignatureKind.NESTED, null, name, declaringType, null, null, null, null);
    }

    public static TypeSignature genericParameter(String name) {
        return new TypeSignature(SignatureKind.GENERIC_PARAMETER, null, name, null, null, null, null, null);
    }

    public static TypeSignature genericInstance(TypeSignature elementType, List<TypeSignature> arguments) {
        return new TypeSignature(SignatureKind.GENERIC_INSTANCE, null, null, null, elementType, null, arguments, null);
    }

    public static TypeSignature array(TypeSignature elementType, int rank) {
        return new TypeSignature(SignatureKind.ARRAY, null, null, null, elementType, null, null, rank);
    }

    public static TypeSignature array(TypeSignature elementType) {
        return array(elementType, 1);
    }

    public static TypeSignature pointer(TypeSignature elementType) {
        return new TypeSignature(SignatureKind.POINTER, null, null, null, elementType, null, null, null);
    }

    public static TypeSignature byReference(TypeSignature elementType) {
        return new TypeSignature(SignatureKind.BY_REFERENCE, null, null, null, elementType, null, null, null);
    }

    public static TypeSignature optionalModifier(TypeSignature modifierType, TypeSignature elementType) {
        return new TypeSignature(SignatureKind.OPTIONAL_MODIFIER, null, null, null, elementType, modifierType, null, null);
    }

    public static TypeSignature requiredModifier(TypeSignature modifierType, TypeSignature elementType) {
        return new TypeSignature(SignatureKind.REQUIRED_MODIFIER, null, null, null, elementType, modifierType, null, null);
    }

    /**
     * Metadata full name, e.g. {@code System.Collections.Generic.List`1<System.String>[]}.
     * Nested types use {@code Outer/Inner}.
     */
    public String fullName() {
        switch (kind) {
            case NAMED:
                return namespace.isEmpty() ? String.valueOf(name) : namespace + "." + name;
            case NESTED:
                return (declaringType == null ? "?" : declaringType.fullName()) + "/" + name;
            case GENERIC_PARAMETER:
                return String.valueOf(name);
            case BY_REFERENCE:
                return elementName() + "&";
            case POINTER:
                return elementName() + "*";
            case ARRAY:
                return elementName() + "[" + ",".repeat(rank - 1) + "]";
            case GENERIC_INSTANCE: {
                StringBuilder sb = new StringBuilder(elementName()).append('<');
                for (int i = 0; i < genericArguments.size(); i++) {
                    if (i > 0) sb.append(',');
                    sb.append(genericArguments.get(i) == null ? "?" : genericArguments.get(i).fullName());
                }
                return sb.append('>').toString();
            }
            case OPTIONAL_MODIFIER:
                return elementName() + " modopt(" + (modifierType == null ? "?" : modifierType.fullName()) + ")";
            case REQUIRED_MODIFIER:
                return elementName() + " modreq(" + (modifierType == null ? "?" : modifierType.fullName()) + ")";
            default:
                throw new IllegalStateException("Unhandled signature kind: " + kind);
        }
    }

    private String elementName() {
        return elementType == null ? "?" : elementType.fullName();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeSignature)) return false;
        TypeSignature that = (TypeSignature) o;
        return kind == that.kind &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(name, that.name) &&
                Objects.equals(declaringType, that.declaringType) &&
                Objects.equals(elementType, that.elementType) &&
                Objects.equals(modifierType, that.modifierType) &&
                Objects.equals(genericArguments, that.genericArguments) &&
                Objects.equals(rank, that.rank);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, namespace, name, declaringType, elementType, modifierType, genericArguments, rank);
    }

    @Override public String toString() {
        return fullName();
    }
}
