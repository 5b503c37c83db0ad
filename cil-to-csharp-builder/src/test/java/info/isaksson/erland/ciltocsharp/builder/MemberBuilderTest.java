package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.BlockStatement;
import info.isaksson.erland.ciltocsharp.ast.ConstructorDeclaration;
import info.isaksson.erland.ciltocsharp.ast.EventDeclaration;
import info.isaksson.erland.ciltocsharp.ast.FieldDeclaration;
import info.isaksson.erland.ciltocsharp.ast.MethodDeclaration;
import info.isaksson.erland.ciltocsharp.ast.Modifier;
import info.isaksson.erland.ciltocsharp.ast.Modifiers;
import info.isaksson.erland.ciltocsharp.ast.PropertyDeclaration;
import info.isaksson.erland.ciltocsharp.ast.RawStatement;
import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.ast.TypeExpressionPrinter;
import info.isaksson.erland.ciltocsharp.metadata.CompiledEvent;
import info.isaksson.erland.ciltocsharp.metadata.CompiledField;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;
import info.isaksson.erland.ciltocsharp.metadata.CompiledParameter;
import info.isaksson.erland.ciltocsharp.metadata.CompiledProperty;
import info.isaksson.erland.ciltocsharp.metadata.MemberAccess;
import info.isaksson.erland.ciltocsharp.metadata.TypeSignature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.ciltocsharp.builder.CompiledFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class MemberBuilderTest {

    private AstBuildContext ctx;
    private MemberBuilder builder;

    @BeforeEach
    void setUp() {
        ctx = new AstBuildContext();
        builder = new MemberBuilder(ctx, new SnapshotBodyReconstructor());
    }

    @Test
    void fieldUsesItsOwnAttributesForDynamic() {
        FieldDeclaration f = builder.createField(
                new CompiledField("state", OBJECT, MemberAccess.PRIVATE, false, false, List.of(dynamicMarker())));
        assertEquals("state", f.name);
        assertEquals(TypeExpression.primitive("dynamic"), f.returnType);
        assertEquals(Modifiers.of(Modifier.PRIVATE), f.modifiers);
        assertEquals(1, ctx.stats.fieldsCreated);
    }

    @Test
    void eventTakesModifiersFromAddAccessor() {
        CompiledMethod add = new CompiledMethod("add_Changed", MemberAccess.PUBLIC, true, false, false, true, false, VOID, null, null, null);
        EventDeclaration e = builder.createEvent(new CompiledEvent("Changed", TypeSignature.named("System", "EventHandler"), add, null, null));
        assertEquals(Modifiers.of(Modifier.PUBLIC, Modifier.STATIC), e.modifiers);
        assertEquals("System.EventHandler", TypeExpressionPrinter.print(e.returnType));

        EventDeclaration bare = builder.createEvent(new CompiledEvent("Raw", TypeSignature.named("System", "EventHandler"), null, null, null));
        assertTrue(bare.modifiers.isEmpty());
        assertEquals(2, ctx.stats.eventsCreated);
    }

    @Test
    void propertyModifiersComeFromGetterThenSetter() {
        CompiledMethod getter = new CompiledMethod("get_Name", MemberAccess.PUBLIC, false, true, false, true, false,
                STRING, null, null, List.of("return name;"));
        CompiledMethod setter = new CompiledMethod("set_Name", MemberAccess.FAMILY, false, false, false, true, false,
                VOID, null, List.of(CompiledParameter.of("value", STRING)), List.of("name = value;"));

        PropertyDeclaration p = builder.createProperty(new CompiledProperty("Name", STRING, getter, setter, null));
        assertEquals(Modifiers.of(Modifier.PUBLIC, Modifier.VIRTUAL), p.modifiers);
        assertEquals(new BlockStatement(List.of(new RawStatement("return name;"))), p.getter.body);
        assertEquals(new BlockStatement(List.of(new RawStatement("name = value;"))), p.setter.body);

        PropertyDeclaration writeOnly = builder.createProperty(new CompiledProperty("Secret", STRING, null, setter, null));
        assertEquals(Modifiers.of(Modifier.PROTECTED), writeOnly.modifiers);
        assertNull(writeOnly.getter);
        assertNotNull(writeOnly.setter);
    }

    @Test
    void abstractAccessorHasNoBody() {
        CompiledMethod getter = new CompiledMethod("get_Area", MemberAccess.PUBLIC, false, true, true, true, false,
                INT32, null, null, null);
        PropertyDeclaration p = builder.createProperty(new CompiledProperty("Area", INT32, getter, null, null));
        assertNull(p.getter.body);
        assertEquals(Modifiers.of(Modifier.PUBLIC, Modifier.VIRTUAL, Modifier.ABSTRACT), p.modifiers);
    }

    @Test
    void constructorIsNamedAfterDeclaringType() {
        ConstructorDeclaration c = builder.createConstructor(
                constructor(MemberAccess.PUBLIC, CompiledParameter.of("capacity", INT32)), "Cache`1");
        assertEquals("Cache`1", c.name);
        assertEquals(Modifiers.of(Modifier.PUBLIC), c.modifiers);
        assertEquals(1, c.parameters.size());
        assertEquals(BlockStatement.empty(), c.body);
        assertEquals(1, ctx.stats.constructorsCreated);
    }

    @Test
    void methodReturnTypeUsesReturnAttributes() {
        CompiledMethod m = new CompiledMethod("Load", MemberAccess.PUBLIC, false, false, false, false, false,
                OBJECT, List.of(dynamicMarker()), List.of(CompiledParameter.of("key", OBJECT)), List.of("return null;"));

        MethodDeclaration md = builder.createMethod(m);
        assertEquals(TypeExpression.primitive("dynamic"), md.returnType);
        assertEquals("System.Object", TypeExpressionPrinter.print(md.parameters.get(0).type));
        assertEquals(1, md.body.statements.size());
        assertEquals(1, ctx.stats.methodsCreated);
    }

    @Test
    void reconstructorFailurePropagates() {
        MemberBuilder failing = new MemberBuilder(ctx, method -> {
            throw new IllegalStateException("cannot decompile " + method.name);
        });
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> failing.createMethod(method("Broken", MemberAccess.PUBLIC, VOID)));
        assertEquals("cannot decompile Broken", ex.getMessage());
        assertEquals(0, ctx.stats.methodsCreated);
    }

    @Test
    void nullMemberNameIsMalformed() {
        assertThrows(MalformedMetadataException.class,
                () -> builder.createField(new CompiledField(null, INT32, MemberAccess.PUBLIC, false, false, null)));
    }

    @Test
    void ordinaryMethodExcludesConstructorsAndSpecialNames() {
        assertTrue(MemberBuilder.isOrdinaryMethod(method("Run", MemberAccess.PUBLIC, VOID)));
        assertFalse(MemberBuilder.isOrdinaryMethod(constructor(MemberAccess.PUBLIC)));
        assertFalse(MemberBuilder.isOrdinaryMethod(typeInitializer()));
        assertFalse(MemberBuilder.isOrdinaryMethod(accessor("op_Addition", MemberAccess.PUBLIC, INT32)));
    }
}
