package info.isaksson.erland.ciltocsharp.ast;

/** Parameter passing direction. {@code in}, {@code params} and {@code this} are not reconstructed. */
public enum ParameterModifier {
    NONE,
    REF,
    OUT
}
