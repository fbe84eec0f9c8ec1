package com.ffibind.generator.model.declaration;

import java.util.List;
import java.util.Optional;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * Argument list of a signal. A slot wrapper is generated per distinct list.
 */
@Value
public class SignalArgumentsDeclaration implements NativeDeclaration {

    @NonNull
    List<NativeType> argumentTypes;

    public SignalArgumentsDeclaration(@NonNull List<NativeType> argumentTypes) {
        this.argumentTypes = List.copyOf(argumentTypes);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ItemPath> path() {
        return Optional.empty();
    }
}
