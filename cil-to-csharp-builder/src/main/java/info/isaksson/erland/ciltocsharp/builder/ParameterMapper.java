package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.ParameterDeclaration;
import info.isaksson.erland.ciltocsharp.ast.ParameterModifier;
import info.isaksson.erland.ciltocsharp.metadata.CompiledParameter;

import java.util.ArrayList;
import java.util.List;

/** Maps compiled parameters to parameter declarations, keeping declared order. */
public final class ParameterMapper {

    private ParameterMapper() {}

    public static List<ParameterDeclaration> map(List<CompiledParameter> parameters) {
        List<ParameterDeclaration> out = new ArrayList<>(parameters.size());
        for (CompiledParameter p : parameters) {
            out.add(new ParameterDeclaration(
                    p.name,
                    TypeReferenceDecoder.decode(p.parameterType, p),
                    direction(p)
            ));
        }
        return List.copyOf(out);
    }

    // TODO: params arrays and extension-method "this" parameters need their attributes inspected.
    static ParameterModifier direction(CompiledParameter p) {
        if (!p.isIn && p.isOut) return ParameterModifier.OUT;
        if (p.isIn && p.isOut) return ParameterModifier.REF;
        return ParameterModifier.NONE;
    }
}
