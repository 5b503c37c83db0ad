package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Objects;

/** A statement already rendered to source text by the body reconstructor; printed verbatim. */
@JsonTypeName("raw")
public final class RawStatement implements Statement {
    public final String text;

    public RawStatement(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawStatement)) return false;
        return text.equals(((RawStatement) o).text);
    }

    @Override public int hashCode() {
        return text.hashCode();
    }

    @Override public String toString() {
        return text;
    }
}
