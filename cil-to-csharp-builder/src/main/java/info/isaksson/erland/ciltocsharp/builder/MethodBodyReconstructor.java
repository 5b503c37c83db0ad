package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.BlockStatement;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;

/**
 * Turns a method's instructions into a statement block.
 *
 * <p>Called synchronously once per method, constructor and property accessor. Exceptions thrown
 * here are not caught by the builders and abort the module translation.</p>
 */
@FunctionalInterface
public interface MethodBodyReconstructor {

    /** @return the body, or null when the method has none (abstract or interface methods) */
    BlockStatement reconstruct(CompiledMethod method);
}
