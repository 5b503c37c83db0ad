package info.isaksson.erland.ciltocsharp.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CSharpPrinterTest {

    private static final TypeExpression INT32 = TypeExpression.dotted("System.Int32");
    private static final TypeExpression VOID = TypeExpression.dotted("System.Void");

    private static CompilationUnit sampleUnit() {
        TypeDeclaration foo = new TypeDeclaration("Foo", ClassType.CLASS, Modifiers.of(Modifier.PUBLIC),
                List.of(TypeExpression.simple("Base"), TypeExpression.simple("IX")),
                List.of(
                        new FieldDeclaration("count", INT32, Modifiers.of(Modifier.PRIVATE)),
                        new FieldDeclaration("Max", INT32, Modifiers.of(Modifier.STATIC, Modifier.CONST, Modifier.PUBLIC)),
                        new MethodDeclaration("Run", VOID, Modifiers.of(Modifier.PUBLIC),
                                List.of(new ParameterDeclaration("n", INT32, ParameterModifier.REF)),
                                new BlockStatement(List.of(new RawStatement("n++;"))))
                ));
        TypeDeclaration program = new TypeDeclaration("Program", ClassType.CLASS, Modifiers.none(), null, null);
        return new CompilationUnit(
                List.of(new UsingDeclaration(TypeExpression.simple("System"))),
                List.of(new NamespaceDeclaration("Acme", List.of(foo)), program));
    }

    @Test
    void printsUnitWithDecompilerPolicy() {
        String expected = String.join("\n",
                "using System;",
                "",
                "namespace Acme",
                "{",
                "\tpublic class Foo : Base, IX",
                "\t{",
                "\t\tprivate System.Int32 count;",
                "",
                "\t\tpublic const System.Int32 Max;",
                "",
                "\t\tpublic System.Void Run(ref System.Int32 n)",
                "\t\t{",
                "\t\t\tn++;",
                "\t\t}",
                "\t}",
                "}",
                "",
                "class Program",
                "{",
                "}",
                "");
        assertEquals(expected, CSharpPrinter.printToString(sampleUnit(), FormattingPolicy.decompilerDefault()));
    }

    @Test
    void defaultPolicyPutsSpaceBeforeDeclarationParens() {
        String s = CSharpPrinter.printToString(sampleUnit(), new FormattingPolicy());
        assertTrue(s.contains("public System.Void Run (ref System.Int32 n)"), s);
    }

    @Test
    void customIndentationAndNewLine() {
        FormattingPolicy policy = FormattingPolicy.decompilerDefault();
        policy.indentation = "    ";
        policy.newLine = "\r\n";
        String s = CSharpPrinter.printToString(sampleUnit(), policy);
        assertTrue(s.contains("\r\n    public class Foo : Base, IX\r\n"), s);
    }

    @Test
    void printsEnumAsLiteralList() {
        TypeDeclaration kind = new TypeDeclaration("Kind", ClassType.ENUM, Modifiers.of(Modifier.PUBLIC), null, List.of(
                new FieldDeclaration("value__", INT32, Modifiers.of(Modifier.PUBLIC)),
                new FieldDeclaration("Round", TypeExpression.simple("Kind"), Modifiers.of(Modifier.PUBLIC, Modifier.CONST, Modifier.STATIC)),
                new FieldDeclaration("Angular", TypeExpression.simple("Kind"), Modifiers.of(Modifier.PUBLIC, Modifier.CONST, Modifier.STATIC))
        ));
        CompilationUnit unit = new CompilationUnit(null, List.of(kind));
        assertEquals("public enum Kind\n{\n\tRound,\n\tAngular,\n}\n",
                CSharpPrinter.printToString(unit, FormattingPolicy.decompilerDefault()));
    }

    @Test
    void printsAbstractMembersEventsAndOutParameters() {
        TypeDeclaration shape = new TypeDeclaration("Shape", ClassType.CLASS, Modifiers.of(Modifier.PUBLIC, Modifier.ABSTRACT), null, List.of(
                new EventDeclaration("Changed", TypeExpression.simple("EventHandler"), Modifiers.of(Modifier.PUBLIC)),
                new PropertyDeclaration("Area", TypeExpression.primitive("double"),
                        Modifiers.of(Modifier.PUBLIC, Modifier.ABSTRACT), new Accessor(null), null),
                new ConstructorDeclaration("Shape", Modifiers.of(Modifier.PROTECTED), null, BlockStatement.empty()),
                new MethodDeclaration("TryGet", TypeExpression.primitive("bool"), Modifiers.of(Modifier.PUBLIC, Modifier.ABSTRACT),
                        List.of(new ParameterDeclaration("value", INT32, ParameterModifier.OUT)), null)
        ));
        String s = CSharpPrinter.printToString(new CompilationUnit(null, List.of(shape)), FormattingPolicy.decompilerDefault());

        assertTrue(s.startsWith("public abstract class Shape\n"), s);
        assertTrue(s.contains("\tpublic event EventHandler Changed;\n"), s);
        assertTrue(s.contains("\tpublic abstract double Area\n\t{\n\t\tget;\n\t}\n"), s);
        assertTrue(s.contains("\tprotected Shape()\n\t{\n\t}\n"), s);
        assertTrue(s.contains("\tpublic abstract bool TryGet(out System.Int32 value);\n"), s);
    }
}
