package com.ffibind.generator.model.declaration;

import java.util.List;
import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A free function or a class method.
 */
@Value
@Builder(toBuilder = true)
public class FunctionDeclaration implements NativeDeclaration {

    @NonNull
    ItemPath path;

    @NonNull
    NativeType returnType;

    @NonNull
    @Singular
    List<Argument> arguments;

    /**
     * Set for methods; the path's parent is then the owning class.
     */
    boolean method;

    boolean constMethod;

    boolean staticMethod;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.of(path);
    }

    @Value(staticConstructor = "of")
    public static class Argument {

        @NonNull
        String name;

        @NonNull
        NativeType type;

        boolean hasDefaultValue;
    }
}
