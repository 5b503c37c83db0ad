package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.metadata.AttributeArgument;
import info.isaksson.erland.ciltocsharp.metadata.CustomAttribute;
import info.isaksson.erland.ciltocsharp.metadata.CustomAttributeProvider;
import info.isaksson.erland.ciltocsharp.metadata.MetadataNames;

/**
 * Reads the compiler's {@code DynamicAttribute}, which marks {@code object} slots that were
 * declared {@code dynamic} in source.
 *
 * <p>The attribute either has no arguments (the whole slot is dynamic) or a single {@code bool[]}
 * with one flag per type-signature position, in pre-order.</p>
 */
public final class DynamicAttributes {

    private DynamicAttributes() {}

    public static boolean hasDynamicAttribute(CustomAttributeProvider attributeProvider, int typeIndex) {
        if (attributeProvider == null || !attributeProvider.hasCustomAttributes()) return false;
        for (CustomAttribute a : attributeProvider.customAttributes()) {
            if (!MetadataNames.DYNAMIC_ATTRIBUTE.equals(a.attributeType)) continue;
            if (a.constructorArguments.size() == 1) {
                AttributeArgument flags = a.constructorArguments.get(0);
                if (flags.isArray() && typeIndex < flags.elements.size()) {
                    Object v = flags.elements.get(typeIndex).value;
                    if (v instanceof Boolean) return (Boolean) v;
                }
            }
            return true;
        }
        return false;
    }
}
