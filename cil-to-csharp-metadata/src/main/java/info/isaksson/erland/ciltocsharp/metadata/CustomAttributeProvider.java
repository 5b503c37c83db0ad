package info.isaksson.erland.ciltocsharp.metadata;

import java.util.List;

/** A metadata element that can carry custom attributes. */
public interface CustomAttributeProvider {

    List<CustomAttribute> customAttributes();

    default boolean hasCustomAttributes() {
        List<CustomAttribute> attrs = customAttributes();
        return attrs != null && !attrs.isEmpty();
    }
}
