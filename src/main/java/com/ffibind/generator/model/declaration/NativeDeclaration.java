package com.ffibind.generator.model.declaration;

import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

/**
 * An entity discovered in the wrapped library's declarations.
 *
 * Implementations are value types: two declarations are the same declaration
 * exactly when they are {@code equals}.
 */
public interface NativeDeclaration {

    <R> R accept(DeclarationVisitor<R> visitor);

    /**
     * Path of the declared entity, or empty for declarations that have none.
     */
    Optional<ItemPath> path();

    /**
     * Short human-readable form used in log output.
     */
    default String describe() {
        return accept(DeclarationDescriber.INSTANCE);
    }
}
