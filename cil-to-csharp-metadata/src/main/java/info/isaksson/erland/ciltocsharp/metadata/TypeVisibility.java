package info.isaksson.erland.ciltocsharp.metadata;

/** Type visibility as encoded in the type attribute flags (ECMA-335 II.23.1.15). */
public enum TypeVisibility {
    NOT_PUBLIC,
    PUBLIC,
    NESTED_PUBLIC,
    NESTED_PRIVATE,
    NESTED_FAMILY,
    NESTED_ASSEMBLY,
    NESTED_FAMILY_AND_ASSEMBLY,
    NESTED_FAMILY_OR_ASSEMBLY
}
