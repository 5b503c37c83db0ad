package info.isaksson.erland.ciltocsharp.ast;

import java.util.StringJoiner;

/** Renders type expressions as C# source text. */
public final class TypeExpressionPrinter {

    private TypeExpressionPrinter() {}

    public static String print(TypeExpression t) {
        StringBuilder sb = new StringBuilder();
        append(sb, t);
        return sb.toString();
    }

    private static void append(StringBuilder sb, TypeExpression t) {
        if (t == null) return;
        switch (t.kind) {
            case PRIMITIVE:
            case SIMPLE:
                sb.append(t.name);
                break;
            case QUALIFIED:
                append(sb, t.target);
                sb.append('.').append(t.name);
                break;
            case GENERIC:
                append(sb, t.target);
                StringJoiner args = new StringJoiner(", ", "<", ">");
                for (TypeExpression a : t.typeArguments) args.add(print(a));
                sb.append(args);
                break;
            case ARRAY: {
                // Specifiers read outermost first: Array(Array(int,2),1) is int[][,].
                TypeExpression element = t;
                StringBuilder specifiers = new StringBuilder();
                while (element.kind == TypeExpressionKind.ARRAY) {
                    specifiers.append('[').append(",".repeat(element.rank - 1)).append(']');
                    element = element.target;
                }
                append(sb, element);
                sb.append(specifiers);
                break;
            }
            case POINTER:
                append(sb, t.target);
                sb.append('*');
                break;
            case NULL:
                break;
        }
    }
}
