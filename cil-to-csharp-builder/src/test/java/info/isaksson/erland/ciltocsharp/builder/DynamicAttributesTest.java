package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.metadata.AttributeArgument;
import info.isaksson.erland.ciltocsharp.metadata.CustomAttribute;
import info.isaksson.erland.ciltocsharp.metadata.CustomAttributeProvider;
import info.isaksson.erland.ciltocsharp.metadata.MetadataNames;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.ciltocsharp.builder.CompiledFixtures.dynamicMarker;
import static org.junit.jupiter.api.Assertions.*;

public class DynamicAttributesTest {

    private static CustomAttributeProvider attrs(CustomAttribute... attributes) {
        return () -> List.of(attributes);
    }

    @Test
    void absentMarkerIsFalse() {
        assertFalse(DynamicAttributes.hasDynamicAttribute(null, 0));
        assertFalse(DynamicAttributes.hasDynamicAttribute(attrs(), 0));
        assertFalse(DynamicAttributes.hasDynamicAttribute(
                attrs(CustomAttribute.of("System.ObsoleteAttribute")), 0));
    }

    @Test
    void markerWithoutArgumentsIsTrueEverywhere() {
        assertTrue(DynamicAttributes.hasDynamicAttribute(attrs(dynamicMarker()), 0));
        assertTrue(DynamicAttributes.hasDynamicAttribute(attrs(dynamicMarker()), 7));
    }

    @Test
    void flagArrayIsIndexed() {
        CustomAttributeProvider p = attrs(CustomAttribute.of("System.ObsoleteAttribute"), dynamicMarker(false, true, false));
        assertFalse(DynamicAttributes.hasDynamicAttribute(p, 0));
        assertTrue(DynamicAttributes.hasDynamicAttribute(p, 1));
        assertFalse(DynamicAttributes.hasDynamicAttribute(p, 2));
        assertTrue(DynamicAttributes.hasDynamicAttribute(p, 3), "out of range falls back to true");
    }

    @Test
    void otherArgumentShapesAreTrue() {
        CustomAttribute scalar = CustomAttribute.of(MetadataNames.DYNAMIC_ATTRIBUTE, AttributeArgument.ofBoolean(false));
        assertTrue(DynamicAttributes.hasDynamicAttribute(attrs(scalar), 0));

        CustomAttribute twoArgs = CustomAttribute.of(MetadataNames.DYNAMIC_ATTRIBUTE,
                AttributeArgument.booleanArray(false), AttributeArgument.booleanArray(false));
        assertTrue(DynamicAttributes.hasDynamicAttribute(attrs(twoArgs), 0));

        AttributeArgument strings = new AttributeArgument("System.String[]", null,
                List.of(new AttributeArgument("System.String", "no", null)));
        assertTrue(DynamicAttributes.hasDynamicAttribute(
                attrs(CustomAttribute.of(MetadataNames.DYNAMIC_ATTRIBUTE, strings)), 0));
    }
}
