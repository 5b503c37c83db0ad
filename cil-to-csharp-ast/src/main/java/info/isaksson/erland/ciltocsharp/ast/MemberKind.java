package info.isaksson.erland.ciltocsharp.ast;

/** Categories of type members, in emission order. */
public enum MemberKind {
    NESTED_TYPE,
    FIELD,
    EVENT,
    PROPERTY,
    CONSTRUCTOR,
    METHOD
}
