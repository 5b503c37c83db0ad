package info.isaksson.erland.ciltocsharp.core;

import info.isaksson.erland.ciltocsharp.ast.CompilationUnit;
import info.isaksson.erland.ciltocsharp.ast.MemberKind;
import info.isaksson.erland.ciltocsharp.ast.TypeDeclaration;
import info.isaksson.erland.ciltocsharp.builder.SnapshotBodyReconstructor;
import info.isaksson.erland.ciltocsharp.builder.transform.AstTransform;
import info.isaksson.erland.ciltocsharp.builder.transform.TransformPasses;
import info.isaksson.erland.ciltocsharp.metadata.CompiledModule;
import info.isaksson.erland.ciltocsharp.metadata.CompiledType;
import info.isaksson.erland.ciltocsharp.metadata.ModuleJson;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CilToCSharpServiceTest {

    private static Path resource(String name) throws Exception {
        return Path.of(CilToCSharpServiceTest.class.getClassLoader().getResource(name).toURI());
    }

    @Test
    void translatesSampleModuleToExpectedSource() throws Exception {
        CilToCSharpResult res = new CilToCSharpService()
                .translateSnapshot(resource("modules/sample-module.json"), new CilToCSharpOptions());

        String expected = Files.readString(resource("expected/sample-module.cs"), StandardCharsets.UTF_8);
        assertEquals(expected, res.csharp);

        assertEquals(2, res.stats.namespacesCreated);
        assertEquals(6, res.stats.typesCreated);
        assertEquals(1, res.stats.nestedTypesCreated);
        assertEquals(1, res.stats.typesSkipped);
        assertEquals(1, res.stats.specialNameMethodsSkipped);
        assertEquals(2, res.stats.constructorsCreated);
    }

    @Test
    void treeIsReturnedWithoutTextWhenCodeGenerationIsOff() throws Exception {
        CilToCSharpOptions options = new CilToCSharpOptions();
        options.generateCode = false;

        CilToCSharpResult res = new CilToCSharpService().translateSnapshot(resource("modules/sample-module.json"), options);

        assertNull(res.csharp);
        CompilationUnit unit = res.unit;
        TypeDeclaration shape = unit.namespaces().get(0).members.get(0);
        assertEquals("Shape", shape.name);
        assertEquals(1, shape.membersOfKind(MemberKind.NESTED_TYPE).size());
        assertEquals("Program", unit.rootTypes().get(0).name);
    }

    @Test
    void optionsDriveThePassSchedule() {
        AtomicInteger deadLabelRuns = new AtomicInteger();
        AtomicInteger typeRefRuns = new AtomicInteger();
        AstTransform id = AstTransform.identity();
        TransformPasses passes = new TransformPasses(
                unit -> { deadLabelRuns.incrementAndGet(); return unit; },
                id, id, id,
                unit -> { typeRefRuns.incrementAndGet(); return unit; });
        CilToCSharpService service = new CilToCSharpService(new SnapshotBodyReconstructor(), passes);

        CilToCSharpOptions options = new CilToCSharpOptions();
        options.transformIterations = 2;
        options.reduceAstOther = false;
        service.translate(CompiledModule.of("m.dll", List.of(CompiledType.builder("N", "T").build())), options);

        assertEquals(2, deadLabelRuns.get());
        assertEquals(0, typeRefRuns.get());
    }

    @Test
    void nullOptionsUseDefaults() throws Exception {
        CompiledModule module = ModuleJson.read(resource("modules/sample-module.json"));
        CilToCSharpResult res = new CilToCSharpService().translate(module, null);
        assertNotNull(res.csharp);
        assertTrue(res.csharp.startsWith("using System;\n"));
    }

    @Test
    void missingSnapshotFailsWithIOException() {
        Path missing = Path.of("does-not-exist", "module.json");
        assertThrows(NoSuchFileException.class,
                () -> new CilToCSharpService().translateSnapshot(missing, new CilToCSharpOptions()));
        assertThrows(IllegalArgumentException.class,
                () -> new CilToCSharpService().translate(null, new CilToCSharpOptions()));
    }
}
