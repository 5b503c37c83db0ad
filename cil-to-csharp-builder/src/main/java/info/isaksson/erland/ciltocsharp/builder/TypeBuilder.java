package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.ClassType;
import info.isaksson.erland.ciltocsharp.ast.MemberDeclaration;
import info.isaksson.erland.ciltocsharp.ast.TypeDeclaration;
import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.metadata.CompiledEvent;
import info.isaksson.erland.ciltocsharp.metadata.CompiledField;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;
import info.isaksson.erland.ciltocsharp.metadata.CompiledProperty;
import info.isaksson.erland.ciltocsharp.metadata.CompiledType;
import info.isaksson.erland.ciltocsharp.metadata.MetadataNames;
import info.isaksson.erland.ciltocsharp.metadata.TypeSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the declaration of a compiled type, including its nested types.
 *
 * <p>Members are emitted in a fixed order regardless of metadata order: nested types, fields,
 * events, properties, constructors, methods.</p>
 */
public final class TypeBuilder {

    private final AstBuildContext ctx;
    private final MemberBuilder memberBuilder;

    public TypeBuilder(AstBuildContext ctx, MemberBuilder memberBuilder) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.memberBuilder = Objects.requireNonNull(memberBuilder, "memberBuilder");
    }

    public TypeDeclaration createType(CompiledType typeDef) {
        String name = MalformedMetadataException.requireName(typeDef.name, "type", typeDef.fullName());

        List<MemberDeclaration> members = new ArrayList<>();
        for (CompiledType nested : typeDef.nestedTypes) {
            members.add(createType(nested));
            ctx.stats.nestedTypesCreated++;
        }

        List<TypeExpression> baseTypes = new ArrayList<>();
        if (typeDef.baseType != null && !typeDef.isValueType && !isObject(typeDef.baseType)) {
            baseTypes.add(TypeReferenceDecoder.decode(typeDef.baseType));
        }
        for (TypeSignature i : typeDef.interfaces) {
            baseTypes.add(TypeReferenceDecoder.decode(i));
        }

        addTypeMembers(members, typeDef);

        ctx.stats.typesCreated++;
        return new TypeDeclaration(name, classType(typeDef), ModifierCalculator.modifiers(typeDef), baseTypes, members);
    }

    // Enums are value types too, so the enum flag is checked first.
    static ClassType classType(CompiledType typeDef) {
        if (typeDef.isEnum) return ClassType.ENUM;
        if (typeDef.isValueType) return ClassType.STRUCT;
        if (typeDef.isInterface) return ClassType.INTERFACE;
        return ClassType.CLASS;
    }

    private void addTypeMembers(List<MemberDeclaration> members, CompiledType typeDef) {
        for (CompiledField fieldDef : typeDef.fields) {
            members.add(memberBuilder.createField(fieldDef));
        }
        for (CompiledEvent eventDef : typeDef.events) {
            members.add(memberBuilder.createEvent(eventDef));
        }
        for (CompiledProperty propDef : typeDef.properties) {
            members.add(memberBuilder.createProperty(propDef));
        }
        for (CompiledMethod methodDef : typeDef.methods) {
            if (!methodDef.isConstructor()) continue;
            members.add(memberBuilder.createConstructor(methodDef, typeDef.name));
        }
        for (CompiledMethod methodDef : typeDef.methods) {
            if (!MemberBuilder.isOrdinaryMethod(methodDef)) {
                if (!methodDef.isConstructor()) ctx.stats.specialNameMethodsSkipped++;
                continue;
            }
            members.add(memberBuilder.createMethod(methodDef));
        }
    }

    private static boolean isObject(TypeSignature type) {
        return MetadataNames.OBJECT_FULL_NAME.equals(type.fullName());
    }
}
