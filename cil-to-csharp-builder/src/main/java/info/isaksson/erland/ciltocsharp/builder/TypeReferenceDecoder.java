package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.metadata.CustomAttributeProvider;
import info.isaksson.erland.ciltocsharp.metadata.MetadataNames;
import info.isaksson.erland.ciltocsharp.metadata.TypeSignature;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts compiled type signatures into C# type expressions.
 *
 * <p>Decoding is innermost-first recursive descent. Alongside the expression it threads a type
 * index that counts the signature positions visited so far (one per by-reference, pointer and
 * array layer, one per generic argument). The index selects the flag in a
 * {@code DynamicAttribute} that decides whether an {@code object} slot is printed as
 * {@code dynamic}.</p>
 */
public final class TypeReferenceDecoder {

    public static final String DYNAMIC_KEYWORD = "dynamic";

    private TypeReferenceDecoder() {}

    public static TypeExpression decode(TypeSignature type) {
        return decode(type, null);
    }

    /**
     * @param typeAttributes attributes of the slot the signature belongs to (field, parameter,
     *                       property, event or method return); may be null.
     * @throws MalformedMetadataException when a type name in the signature is null
     */
    public static TypeExpression decode(TypeSignature type, CustomAttributeProvider typeAttributes) {
        return decode(type, typeAttributes, 0).expression;
    }

    private static Decoded decode(TypeSignature type, CustomAttributeProvider typeAttributes, int typeIndex) {
        if (type == null) {
            return new Decoded(TypeExpression.nullType(), typeIndex);
        }
        // No default branch: a new SignatureKind must be handled here before this compiles.
        return switch (type.kind) {
            case OPTIONAL_MODIFIER, REQUIRED_MODIFIER -> decode(type.elementType, typeAttributes, typeIndex);
            // ref-ness cannot be expressed in a type expression; parameters carry it instead
            case BY_REFERENCE -> decode(type.elementType, typeAttributes, typeIndex + 1);
            case POINTER -> {
                Decoded element = decode(type.elementType, typeAttributes, typeIndex + 1);
                yield new Decoded(TypeExpression.pointer(element.expression), element.nextIndex);
            }
            case ARRAY -> {
                Decoded element = decode(type.elementType, typeAttributes, typeIndex + 1);
                yield new Decoded(TypeExpression.array(element.expression, type.rank), element.nextIndex);
            }
            case GENERIC_INSTANCE -> decodeGenericInstance(type, typeAttributes, typeIndex);
            case GENERIC_PARAMETER -> new Decoded(TypeExpression.simple(requireName(type)), typeIndex);
            case NESTED -> {
                if (type.declaringType == null) {
                    throw new MalformedMetadataException("Nested type without declaring type: " + type);
                }
                Decoded declaring = decode(type.declaringType, typeAttributes, typeIndex);
                String member = ReflectionNames.stripTypeParameterCount(requireName(type));
                yield new Decoded(TypeExpression.qualified(declaring.expression, member), declaring.nextIndex);
            }
            case NAMED -> new Decoded(decodeNamed(type, typeAttributes, typeIndex), typeIndex);
        };
    }

    private static Decoded decodeGenericInstance(TypeSignature type, CustomAttributeProvider typeAttributes, int typeIndex) {
        Decoded base = decode(type.elementType, typeAttributes, typeIndex);
        int index = base.nextIndex;
        if (type.genericArguments.isEmpty()) {
            return base;
        }
        List<TypeExpression> args = new ArrayList<>(type.genericArguments.size());
        for (TypeSignature argument : type.genericArguments) {
            index++;
            Decoded arg = decode(argument, typeAttributes, index);
            args.add(arg.expression);
            index = arg.nextIndex;
        }
        return new Decoded(TypeExpression.generic(base.expression, args), index);
    }

    private static TypeExpression decodeNamed(TypeSignature type, CustomAttributeProvider typeAttributes, int typeIndex) {
        String ns = type.namespace == null ? "" : type.namespace;
        String name = requireName(type);

        if (MetadataNames.OBJECT.equals(name) && MetadataNames.SYSTEM_NAMESPACE.equals(ns)
                && DynamicAttributes.hasDynamicAttribute(typeAttributes, typeIndex)) {
            return TypeExpression.primitive(DYNAMIC_KEYWORD);
        }
        name = ReflectionNames.stripTypeParameterCount(name);
        if (ns.isEmpty()) {
            return TypeExpression.simple(name);
        }
        return TypeExpression.qualified(TypeExpression.dotted(ns), name);
    }

    private static String requireName(TypeSignature type) {
        if (type.name == null) {
            throw new MalformedMetadataException("type.Name returned null. Type: " + type);
        }
        return type.name;
    }

    /** Decoded expression plus the type index to continue with. */
    private static final class Decoded {
        final TypeExpression expression;
        final int nextIndex;

        Decoded(TypeExpression expression, int nextIndex) {
            this.expression = expression;
            this.nextIndex = nextIndex;
        }
    }
}
