package com.ffibind.generator.database;

import java.util.Optional;

import com.ffibind.generator.model.declaration.NativeDeclaration;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.id.NativeItemId;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * A stored native declaration.
 */
@Value
public class NativeDatabaseItem {

    @NonNull
    NativeItemId id;

    @NonNull
    NativeDeclaration declaration;

    /**
     * FFI item this declaration was synthesized from. Only used to drop the
     * declaration when FFI items are cleared; it does not keep the FFI item alive.
     */
    @Getter(AccessLevel.NONE)
    FfiItemId originFfiItem;

    public Optional<FfiItemId> getOriginFfiItem() {
        return Optional.ofNullable(originFfiItem);
    }

    public boolean isSynthesized() {
        return originFfiItem != null;
    }
}
