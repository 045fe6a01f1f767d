package org.faultline.compiler.frontend.resolve;

import org.faultline.compiler.api.CompilationException;

/**
 * Receives resolved nodes in declaration order. May abort the walk by throwing.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * @param node The next resolved node.
     * @throws CompilationException to end the walk.
     */
    void visit(ResolvedNode node) throws CompilationException;
}
