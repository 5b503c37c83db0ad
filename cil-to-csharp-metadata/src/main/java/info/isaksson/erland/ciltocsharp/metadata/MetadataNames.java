package info.isaksson.erland.ciltocsharp.metadata;

/** Well-known metadata names. */
public final class MetadataNames {

    private MetadataNames() {}

    public static final String SYSTEM_NAMESPACE = "System";
    public static final String OBJECT = "Object";
    public static final String OBJECT_FULL_NAME = SYSTEM_NAMESPACE + "." + OBJECT;

    /** Compiler-synthesized type holding module-level members. */
    public static final String MODULE_TYPE = "<Module>";

    public static final String DYNAMIC_ATTRIBUTE = "System.Runtime.CompilerServices.DynamicAttribute";

    public static final String INSTANCE_CONSTRUCTOR = ".ctor";
    public static final String TYPE_INITIALIZER = ".cctor";
}
