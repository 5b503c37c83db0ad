package info.isaksson.erland.ciltocsharp.ast;

public enum ClassType {
    CLASS,
    STRUCT,
    INTERFACE,
    ENUM;

    public String keyword() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
