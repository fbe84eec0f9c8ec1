package com.ffibind.generator.model.type;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * A function pointer type.
 */
@Value
public class FunctionSignatureType implements BindingType {

    @NonNull
    BindingType returnType;

    @NonNull
    List<BindingType> parameterTypes;

    public FunctionSignatureType(@NonNull BindingType returnType, @NonNull List<BindingType> parameterTypes) {
        this.returnType = returnType;
        this.parameterTypes = List.copyOf(parameterTypes);
    }

    public static FunctionSignatureType of(BindingType returnType, BindingType... parameterTypes) {
        return new FunctionSignatureType(returnType, Arrays.asList(parameterTypes));
    }

    @Override
    public <R> R accept(BindingTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return parameterTypes.stream().map(Object::toString).collect(Collectors.joining(", ", "fn(", ")"))
                + " -> " + returnType;
    }
}
