package info.isaksson.erland.ciltocsharp.metadata;

import java.util.List;

/** The return-value slot of a method; carries its own custom attributes. */
public final class MethodReturnType implements CustomAttributeProvider {
    public final TypeSignature returnType;
    private final List<CustomAttribute> customAttributes;

    MethodReturnType(TypeSignature returnType, List<CustomAttribute> customAttributes) {
        this.returnType = returnType;
        this.customAttributes = customAttributes;
    }

    @Override
    public List<CustomAttribute> customAttributes() {
        return customAttributes;
    }
}
