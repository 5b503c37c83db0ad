package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.BlockStatement;
import info.isaksson.erland.ciltocsharp.ast.RawStatement;
import info.isaksson.erland.ciltocsharp.ast.Statement;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;

import java.util.ArrayList;
import java.util.List;

/**
 * Uses the pre-rendered body lines carried in a module snapshot.
 *
 * <p>Methods without body lines get an empty block; abstract methods get no body.</p>
 */
public final class SnapshotBodyReconstructor implements MethodBodyReconstructor {

    @Override
    public BlockStatement reconstruct(CompiledMethod method) {
        if (method.isAbstract) return null;
        List<Statement> statements = new ArrayList<>(method.bodyLines.size());
        for (String line : method.bodyLines) {
            statements.add(new RawStatement(line));
        }
        return new BlockStatement(statements);
    }
}
