package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.ParameterDeclaration;
import info.isaksson.erland.ciltocsharp.ast.ParameterModifier;
import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.ast.TypeExpressionPrinter;
import info.isaksson.erland.ciltocsharp.metadata.CompiledParameter;
import info.isaksson.erland.ciltocsharp.metadata.TypeSignature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.ciltocsharp.builder.CompiledFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class ParameterMapperTest {

    @Test
    void directionFromInOutFlags() {
        TypeSignature refInt = TypeSignature.byReference(INT32);
        assertEquals(ParameterModifier.NONE, ParameterMapper.direction(new CompiledParameter("a", INT32, false, false, null)));
        assertEquals(ParameterModifier.NONE, ParameterMapper.direction(new CompiledParameter("b", INT32, true, false, null)));
        assertEquals(ParameterModifier.OUT, ParameterMapper.direction(new CompiledParameter("c", refInt, false, true, null)));
        assertEquals(ParameterModifier.REF, ParameterMapper.direction(new CompiledParameter("d", refInt, true, true, null)));
    }

    @Test
    void mapsInDeclaredOrderWithOwnAttributes() {
        List<ParameterDeclaration> params = ParameterMapper.map(List.of(
                CompiledParameter.of("first", STRING),
                new CompiledParameter("bag", OBJECT, false, false, List.of(dynamicMarker())),
                new CompiledParameter("result", TypeSignature.byReference(OBJECT), false, true, null)
        ));

        assertEquals(List.of("first", "bag", "result"), params.stream().map(p -> p.name).toList());
        assertEquals("System.String", TypeExpressionPrinter.print(params.get(0).type));
        assertEquals(TypeExpression.primitive("dynamic"), params.get(1).type);
        assertEquals("System.Object", TypeExpressionPrinter.print(params.get(2).type));
        assertEquals(ParameterModifier.OUT, params.get(2).parameterModifier);
    }

    @Test
    void emptyListMapsToEmptyList() {
        assertTrue(ParameterMapper.map(List.of()).isEmpty());
    }
}
