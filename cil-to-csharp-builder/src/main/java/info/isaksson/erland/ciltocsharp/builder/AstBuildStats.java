package info.isaksson.erland.ciltocsharp.builder;

/** Counters collected while building a declaration tree. */
public final class AstBuildStats {
    public int namespacesCreated;
    public int typesCreated;
    public int nestedTypesCreated;
    public int fieldsCreated;
    public int eventsCreated;
    public int propertiesCreated;
    public int constructorsCreated;
    public int methodsCreated;
    /** Accessors, operators and other special-name methods left out of the method list. */
    public int specialNameMethodsSkipped;
    public int typesSkipped;

    @Override public String toString() {
        return "namespaces=" + namespacesCreated +
                ", types=" + typesCreated +
                " (nested " + nestedTypesCreated + ")" +
                ", fields=" + fieldsCreated +
                ", events=" + eventsCreated +
                ", properties=" + propertiesCreated +
                ", constructors=" + constructorsCreated +
                ", methods=" + methodsCreated;
    }
}
