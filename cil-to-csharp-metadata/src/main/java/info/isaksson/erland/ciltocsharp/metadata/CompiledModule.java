package info.isaksson.erland.ciltocsharp.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * The main module of a compiled assembly.
 *
 * <p>{@link #types} is in metadata order. Providers normally list top-level types only, but a
 * flattened listing that also contains nested types is accepted.</p>
 */
@JsonPropertyOrder({"schemaVersion","name","types"})
public final class CompiledModule {
    public static final String CURRENT_SCHEMA_VERSION = "1";

    public final String schemaVersion;
    public final String name;
    public final List<CompiledType> types;

    @JsonCreator
    public CompiledModule(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("name") String name,
            @JsonProperty("types") List<CompiledType> types
    ) {
        this.schemaVersion = schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
        this.name = name;
        this.types = types == null ? List.of() : List.copyOf(types);
    }

    public static CompiledModule of(String name, List<CompiledType> types) {
        return new CompiledModule(CURRENT_SCHEMA_VERSION, name, types);
    }
}
