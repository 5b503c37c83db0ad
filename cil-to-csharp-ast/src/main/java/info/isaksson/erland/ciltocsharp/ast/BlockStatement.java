package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;

/** {@code { ... }} */
@JsonTypeName("block")
public final class BlockStatement implements Statement {
    public final List<Statement> statements;

    public BlockStatement(List<Statement> statements) {
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static BlockStatement empty() {
        return new BlockStatement(List.of());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockStatement)) return false;
        return statements.equals(((BlockStatement) o).statements);
    }

    @Override public int hashCode() {
        return Objects.hash(statements);
    }
}
