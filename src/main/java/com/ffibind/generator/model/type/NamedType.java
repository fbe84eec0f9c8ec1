package com.ffibind.generator.model.type;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * A numeric, enum or struct type, optionally with nested type arguments.
 */
@Value
public class NamedType implements BindingType {

    @NonNull
    ItemPath path;

    /**
     * Empty when the type takes no type arguments.
     */
    @NonNull
    List<BindingType> typeArguments;

    public NamedType(@NonNull ItemPath path, @NonNull List<BindingType> typeArguments) {
        this.path = path;
        this.typeArguments = List.copyOf(typeArguments);
    }

    public static NamedType of(ItemPath path, BindingType... typeArguments) {
        return new NamedType(path, Arrays.asList(typeArguments));
    }

    public static NamedType builtIn(String name) {
        return new NamedType(ItemPath.of(name), List.of());
    }

    public boolean hasTypeArguments() {
        return !typeArguments.isEmpty();
    }

    @Override
    public <R> R accept(BindingTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return path.toString();
        }
        return path + typeArguments.stream().map(Object::toString).collect(Collectors.joining(", ", "<", ">"));
    }
}
