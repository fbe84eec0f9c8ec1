package com.ffibind.generator.model.declaration;

import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * A class or enum type declared by the native library.
 */
@Value(staticConstructor = "of")
public class TypeDeclaration implements NativeDeclaration {

    public enum Kind {
        CLASS,
        ENUM
    }

    @NonNull
    ItemPath path;

    @NonNull
    Kind kind;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.of(path);
    }
}
