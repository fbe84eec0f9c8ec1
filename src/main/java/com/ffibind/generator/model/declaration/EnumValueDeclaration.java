package com.ffibind.generator.model.declaration;

import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * One enumerator. The path's parent is the enum type.
 */
@Value(staticConstructor = "of")
public class EnumValueDeclaration implements NativeDeclaration {

    @NonNull
    ItemPath path;

    long value;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.of(path);
    }
}
