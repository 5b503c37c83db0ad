package info.isaksson.erland.ciltocsharp.ast;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Serializes a declaration tree as C# source text.
 *
 * <p>Braces go on their own line and each nesting level is indented with
 * {@link FormattingPolicy#indentation}.</p>
 */
public final class CSharpPrinter {

    private final FormattingPolicy policy;
    private final StringBuilder out = new StringBuilder();
    private int level;

    public CSharpPrinter(FormattingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public static String printToString(CompilationUnit unit, FormattingPolicy policy) {
        return new CSharpPrinter(policy).print(unit);
    }

    public String print(CompilationUnit unit) {
        Objects.requireNonNull(unit, "unit");
        out.setLength(0);
        level = 0;
        for (UsingDeclaration u : unit.usings) {
            line("using " + TypeExpressionPrinter.print(u.importTarget) + ";");
        }
        boolean first = unit.usings.isEmpty();
        for (UnitMember m : unit.members) {
            if (!first) blankLine();
            first = false;
            if (m instanceof NamespaceDeclaration) {
                printNamespace((NamespaceDeclaration) m);
            } else {
                printType((TypeDeclaration) m);
            }
        }
        return out.toString();
    }

    private void printNamespace(NamespaceDeclaration ns) {
        line("namespace " + ns.name);
        open();
        for (int i = 0; i < ns.members.size(); i++) {
            if (i > 0) blankLine();
            printType(ns.members.get(i));
        }
        close();
    }

    private void printType(TypeDeclaration t) {
        StringBuilder header = new StringBuilder(modifiers(t.modifiers)).append(t.classType.keyword()).append(' ').append(t.name);
        if (!t.baseTypes.isEmpty()) {
            StringJoiner bases = new StringJoiner(", ", " : ", "");
            for (TypeExpression b : t.baseTypes) bases.add(TypeExpressionPrinter.print(b));
            header.append(bases);
        }
        line(header.toString());
        open();
        if (t.classType == ClassType.ENUM) {
            printEnumBody(t);
        } else {
            for (int i = 0; i < t.members.size(); i++) {
                if (i > 0) blankLine();
                printMember(t.members.get(i));
            }
        }
        close();
    }

    // Enum members are the literal fields; the instance value field is an implementation detail.
    private void printEnumBody(TypeDeclaration t) {
        for (MemberDeclaration m : t.members) {
            if (m.memberKind() == MemberKind.FIELD && m.modifiers().contains(Modifier.CONST)) {
                line(m.name() + ",");
            } else if (m.memberKind() == MemberKind.NESTED_TYPE) {
                printType((TypeDeclaration) m);
            }
        }
    }

    private void printMember(MemberDeclaration m) {
        switch (m.memberKind()) {
            case NESTED_TYPE:
                printType((TypeDeclaration) m);
                break;
            case FIELD: {
                FieldDeclaration f = (FieldDeclaration) m;
                line(modifiers(f.modifiers) + type(f.returnType) + f.name + ";");
                break;
            }
            case EVENT: {
                EventDeclaration e = (EventDeclaration) m;
                line(modifiers(e.modifiers) + "event " + type(e.returnType) + e.name + ";");
                break;
            }
            case PROPERTY:
                printProperty((PropertyDeclaration) m);
                break;
            case CONSTRUCTOR: {
                ConstructorDeclaration c = (ConstructorDeclaration) m;
                line(modifiers(c.modifiers) + c.name + declParens() + parameters(c.parameters) + ")");
                printBody(c.body);
                break;
            }
            case METHOD: {
                MethodDeclaration md = (MethodDeclaration) m;
                String header = modifiers(md.modifiers) + type(md.returnType) + md.name + declParens() + parameters(md.parameters) + ")";
                if (md.body == null) {
                    line(header + ";");
                } else {
                    line(header);
                    printBody(md.body);
                }
                break;
            }
        }
    }

    private void printProperty(PropertyDeclaration p) {
        line(modifiers(p.modifiers) + type(p.returnType) + p.name);
        open();
        printAccessor("get", p.getter);
        printAccessor("set", p.setter);
        close();
    }

    private void printAccessor(String keyword, Accessor accessor) {
        if (accessor == null) return;
        if (accessor.body == null) {
            line(keyword + ";");
            return;
        }
        line(keyword);
        printBody(accessor.body);
    }

    private void printBody(BlockStatement body) {
        if (body == null) {
            line(";");
            return;
        }
        open();
        printStatements(body.statements);
        close();
    }

    private void printStatements(List<Statement> statements) {
        for (Statement s : statements) {
            if (s instanceof BlockStatement) {
                open();
                printStatements(((BlockStatement) s).statements);
                close();
            } else {
                line(s.toString());
            }
        }
    }

    private String declParens() {
        return policy.spaceBeforeMethodDeclParens ? " (" : "(";
    }

    private static String parameters(List<ParameterDeclaration> params) {
        StringJoiner j = new StringJoiner(", ");
        for (ParameterDeclaration p : params) {
            String prefix = p.parameterModifier == ParameterModifier.REF ? "ref "
                    : p.parameterModifier == ParameterModifier.OUT ? "out " : "";
            j.add(prefix + TypeExpressionPrinter.print(p.type) + " " + p.name);
        }
        return j.toString();
    }

    private static String type(TypeExpression t) {
        String s = TypeExpressionPrinter.print(t);
        return s.isEmpty() ? "" : s + " ";
    }

    private static String modifiers(Set<Modifier> modifiers) {
        StringBuilder sb = new StringBuilder();
        for (Modifier m : modifiers) {
            // const implies static in C#
            if (m == Modifier.STATIC && modifiers.contains(Modifier.CONST)) continue;
            sb.append(m.keyword()).append(' ');
        }
        return sb.toString();
    }

    private void open() {
        line("{");
        level++;
    }

    private void close() {
        level--;
        line("}");
    }

    private void blankLine() {
        out.append(policy.newLine);
    }

    private void line(String text) {
        for (int i = 0; i < level; i++) out.append(policy.indentation);
        out.append(text).append(policy.newLine);
    }
}
