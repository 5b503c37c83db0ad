package info.isaksson.erland.ciltocsharp.metadata;

/** Member access as encoded in the field/method attribute flags (ECMA-335 II.23.1.5, II.23.1.10). */
public enum MemberAccess {
    COMPILER_CONTROLLED,
    PRIVATE,
    FAMILY_AND_ASSEMBLY,
    ASSEMBLY,
    FAMILY,
    FAMILY_OR_ASSEMBLY,
    PUBLIC
}
