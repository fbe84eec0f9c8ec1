package com.ffibind.generator.model.declaration;

import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * Inheritance relation between two classes.
 */
@Value(staticConstructor = "of")
public class ClassBaseDeclaration implements NativeDeclaration {

    @NonNull
    ItemPath derivedClassPath;

    @NonNull
    ItemPath baseClassPath;

    /**
     * Position of the base in the derived class's base list.
     */
    int baseIndex;

    boolean virtualBase;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.of(derivedClassPath);
    }
}
