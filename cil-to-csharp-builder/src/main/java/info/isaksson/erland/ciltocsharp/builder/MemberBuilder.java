package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.Accessor;
import info.isaksson.erland.ciltocsharp.ast.ConstructorDeclaration;
import info.isaksson.erland.ciltocsharp.ast.EventDeclaration;
import info.isaksson.erland.ciltocsharp.ast.FieldDeclaration;
import info.isaksson.erland.ciltocsharp.ast.MethodDeclaration;
import info.isaksson.erland.ciltocsharp.ast.PropertyDeclaration;
import info.isaksson.erland.ciltocsharp.metadata.CompiledEvent;
import info.isaksson.erland.ciltocsharp.metadata.CompiledField;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;
import info.isaksson.erland.ciltocsharp.metadata.CompiledProperty;

import java.util.Objects;

/**
 * Builds one declaration per compiled field, event, property, constructor or method.
 *
 * <p>Bodies are requested from the {@link MethodBodyReconstructor}; its failures propagate.</p>
 */
public final class MemberBuilder {

    private final AstBuildContext ctx;
    private final MethodBodyReconstructor bodies;

    public MemberBuilder(AstBuildContext ctx, MethodBodyReconstructor bodies) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.bodies = Objects.requireNonNull(bodies, "bodies");
    }

    public FieldDeclaration createField(CompiledField fieldDef) {
        FieldDeclaration f = new FieldDeclaration(
                MalformedMetadataException.requireName(fieldDef.name, "field", fieldDef),
                TypeReferenceDecoder.decode(fieldDef.fieldType, fieldDef),
                ModifierCalculator.modifiers(fieldDef)
        );
        ctx.stats.fieldsCreated++;
        return f;
    }

    public EventDeclaration createEvent(CompiledEvent eventDef) {
        EventDeclaration e = new EventDeclaration(
                MalformedMetadataException.requireName(eventDef.name, "event", eventDef.eventType),
                TypeReferenceDecoder.decode(eventDef.eventType, eventDef),
                ModifierCalculator.modifiers(eventDef.addMethod)
        );
        ctx.stats.eventsCreated++;
        return e;
    }

    /** Modifiers come from the getter; write-only properties use the setter's. */
    public PropertyDeclaration createProperty(CompiledProperty propDef) {
        String name = MalformedMetadataException.requireName(propDef.name, "property", propDef.propertyType);
        CompiledMethod modifierSource = propDef.getMethod != null ? propDef.getMethod : propDef.setMethod;

        Accessor getter = null;
        if (propDef.getMethod != null) {
            getter = new Accessor(bodies.reconstruct(propDef.getMethod));
        }
        Accessor setter = null;
        if (propDef.setMethod != null) {
            setter = new Accessor(bodies.reconstruct(propDef.setMethod));
        }

        PropertyDeclaration p = new PropertyDeclaration(
                name,
                TypeReferenceDecoder.decode(propDef.propertyType, propDef),
                ModifierCalculator.modifiers(modifierSource),
                getter,
                setter
        );
        ctx.stats.propertiesCreated++;
        return p;
    }

    /** @param typeName name of the declaring type, used as the constructor's name */
    public ConstructorDeclaration createConstructor(CompiledMethod methodDef, String typeName) {
        ConstructorDeclaration c = new ConstructorDeclaration(
                typeName,
                ModifierCalculator.modifiers(methodDef),
                ParameterMapper.map(methodDef.parameters),
                bodies.reconstruct(methodDef)
        );
        ctx.stats.constructorsCreated++;
        return c;
    }

    public MethodDeclaration createMethod(CompiledMethod methodDef) {
        MethodDeclaration m = new MethodDeclaration(
                MalformedMetadataException.requireName(methodDef.name, "method", methodDef),
                TypeReferenceDecoder.decode(methodDef.returnType, methodDef.returnParameter()),
                ModifierCalculator.modifiers(methodDef),
                ParameterMapper.map(methodDef.parameters),
                bodies.reconstruct(methodDef)
        );
        ctx.stats.methodsCreated++;
        return m;
    }

    /** Constructors and special-name methods (accessors, operators) are not emitted as methods. */
    public static boolean isOrdinaryMethod(CompiledMethod methodDef) {
        return !methodDef.isConstructor() && !methodDef.isSpecialName;
    }
}
