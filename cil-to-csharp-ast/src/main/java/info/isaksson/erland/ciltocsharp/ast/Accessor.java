package info.isaksson.erland.ciltocsharp.ast;

import java.util.Objects;

/** A property {@code get} or {@code set} accessor. A null body prints as {@code get;}. */
public final class Accessor {
    public final BlockStatement body;

    public Accessor(BlockStatement body) {
        this.body = body;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Accessor)) return false;
        return Objects.equals(body, ((Accessor) o).body);
    }

    @Override public int hashCode() {
        return Objects.hashCode(body);
    }
}
