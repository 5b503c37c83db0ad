package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A statement inside a reconstructed method body. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlockStatement.class, name = "block"),
        @JsonSubTypes.Type(value = RawStatement.class, name = "raw")
})
public interface Statement {
}
