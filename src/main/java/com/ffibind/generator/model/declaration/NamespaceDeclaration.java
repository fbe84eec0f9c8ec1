package com.ffibind.generator.model.declaration;

import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class NamespaceDeclaration implements NativeDeclaration {

    @NonNull
    ItemPath path;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.of(path);
    }
}
