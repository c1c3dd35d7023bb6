package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.SourceFile;

import java.util.List;
import java.util.Set;

/**
 * A constructor definition with a body, found in a class body or out of line.
 *
 * @param className  the constructor name
 * @param scope      enclosing namespaces and classes, outermost first, excluding the class itself
 * @param file       file holding the definition
 * @param begin      offset of the first token of the (qualified) constructor name
 * @param end        end offset of the body
 * @param paramNames named parameters, which shadow fields inside initializer expressions
 */
record RawConstructor(
        String className,
        List<String> scope,
        SourceFile file,
        int begin,
        int end,
        List<RawInitializer> initializers,
        Set<String> paramNames
) {

    RawConstructor {
        scope = List.copyOf(scope);
        initializers = List.copyOf(initializers);
        paramNames = Set.copyOf(paramNames);
    }

    String qualifiedName() {
        return scope.isEmpty() ? className : String.join("::", scope) + "::" + className;
    }
}
