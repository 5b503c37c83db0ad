package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON snapshot format for compiled modules.
 *
 * <p>Metadata readers write a module once; the translator reads it back. List order is
 * significant (it drives emission order) and is never re-sorted.</p>
 */
public final class ModuleJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ModuleJson() {}

    public static CompiledModule read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, CompiledModule.class);
        }
    }

    /** Parse a module snapshot from a JSON string. */
    public static CompiledModule readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, CompiledModule.class);
    }

    public static void write(CompiledModule module, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Files.createDirectories(path.toAbsolutePath().normalize().getParent());
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, module);
            out.write('\n');
        }
    }

    public static String toJsonString(CompiledModule module) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(module) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        // Snapshots from newer readers may carry extra metadata we do not use.
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
