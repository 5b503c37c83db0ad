package info.isaksson.erland.ciltocsharp.builder.transform;

import info.isaksson.erland.ciltocsharp.ast.BlockStatement;
import info.isaksson.erland.ciltocsharp.ast.ClassType;
import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.ast.MethodDeclaration;
import info.isaksson.erland.ciltocsharp.ast.Modifier;
import info.isaksson.erland.ciltocsharp.ast.Modifiers;
import info.isaksson.erland.ciltocsharp.ast.TypeDeclaration;
import info.isaksson.erland.ciltocsharp.ast.TypeExpression;
import info.isaksson.erland.ciltocsharp.builder.DecompilerSettings;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformOrchestratorTest {

    private final List<String> calls = new ArrayList<>();

    private AstTransform recording(String name) {
        return unit -> {
            calls.add(name);
            return unit;
        };
    }

    private TransformPasses recordingPasses() {
        return new TransformPasses(recording("deadLabels"), recording("idioms"), recording("emptyElse"),
                recording("negation"), recording("typeRefs"));
    }

    private static CompilationUnit unit() {
        TypeDeclaration t = new TypeDeclaration("C", ClassType.CLASS, Modifiers.of(Modifier.PUBLIC), null, List.of(
                new MethodDeclaration("M", TypeExpression.primitive("void"), Modifiers.of(Modifier.PUBLIC), null, BlockStatement.empty())));
        return new CompilationUnit(null, List.of(t));
    }

    @Test
    void defaultScheduleRunsFourRoundsThenTail() {
        new TransformOrchestrator(new DecompilerSettings(), recordingPasses()).run(unit());

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            expected.addAll(List.of("deadLabels", "idioms", "emptyElse", "negation"));
        }
        expected.addAll(List.of("typeRefs", "idioms"));
        assertEquals(expected, calls);
    }

    @Test
    void otherReductionsOffLeavesOnlyDeadLabelRemoval() {
        DecompilerSettings s = new DecompilerSettings();
        s.reduceAstOther = false;
        s.transformIterations = 3;
        new TransformOrchestrator(s, recordingPasses()).run(unit());
        assertEquals(Collections.nCopies(3, "deadLabels"), calls);
    }

    @Test
    void jumpsOffSkipsDeadLabelRemoval() {
        DecompilerSettings s = new DecompilerSettings();
        s.reduceAstJumps = false;
        s.transformIterations = 1;
        new TransformOrchestrator(s, recordingPasses()).run(unit());
        assertEquals(List.of("idioms", "emptyElse", "negation", "typeRefs", "idioms"), calls);
    }

    @Test
    void loopFlagHasNoEffect() {
        DecompilerSettings s = new DecompilerSettings();
        s.reduceAstLoops = false;
        new TransformOrchestrator(s, recordingPasses()).run(unit());
        assertEquals(18, calls.size());
    }

    @Test
    void zeroIterationsRunsOnlyTheTail() {
        DecompilerSettings s = new DecompilerSettings();
        s.transformIterations = 0;
        new TransformOrchestrator(s, recordingPasses()).run(unit());
        assertEquals(List.of("typeRefs", "idioms"), calls);

        calls.clear();
        s.reduceAstOther = false;
        CompilationUnit in = unit();
        assertSame(in, new TransformOrchestrator(s, recordingPasses()).run(in));
        assertTrue(calls.isEmpty());
    }

    @Test
    void eachPassSeesThePreviousOutput() {
        AstTransform renameType = unit -> {
            TypeDeclaration t = unit.rootTypes().get(0);
            TypeDeclaration renamed = new TypeDeclaration(t.name + "x", t.classType, t.modifiers, t.baseTypes, t.members);
            return unit.withMembers(List.of(renamed));
        };
        AstTransform id = AstTransform.identity();
        DecompilerSettings s = new DecompilerSettings();
        s.transformIterations = 2;

        CompilationUnit out = new TransformOrchestrator(s, new TransformPasses(renameType, id, id, id, id)).run(unit());
        assertEquals("Cxx", out.rootTypes().get(0).name);
    }

    @Test
    void printUsesNoSpaceBeforeParens() {
        TransformOrchestrator orchestrator = new TransformOrchestrator(new DecompilerSettings(), TransformPasses.identity());
        String code = orchestrator.print(orchestrator.run(unit()));
        assertEquals("public class C\n{\n\tpublic void M()\n\t{\n\t}\n}\n", code);
    }

    @Test
    void passesMustNotBeNull() {
        AstTransform id = AstTransform.identity();
        assertThrows(NullPointerException.class, () -> new TransformPasses(id, null, id, id, id));
    }
}
