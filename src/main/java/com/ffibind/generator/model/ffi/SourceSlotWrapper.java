package com.ffibind.generator.model.ffi;

import java.util.List;

import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.type.BindingType;

import lombok.NonNull;
import lombok.Value;

/**
 * A slot wrapper class that forwards a signal to a callback.
 * Unlike {@link WrapperFunction} it needs helper source to be emitted.
 */
@Value
public class SourceSlotWrapper implements FfiItem {

    @NonNull
    ItemPath classPath;

    @NonNull
    List<BindingType> signalArgumentTypes;

    /**
     * Normalized signature the slot is connected with, e.g. {@code slot_(int,bool)}.
     */
    @NonNull
    String receiverSignature;

    public SourceSlotWrapper(@NonNull ItemPath classPath, @NonNull List<BindingType> signalArgumentTypes,
                             @NonNull String receiverSignature) {
        this.classPath = classPath;
        this.signalArgumentTypes = List.copyOf(signalArgumentTypes);
        this.receiverSignature = receiverSignature;
    }

    @Override
    public <R> R accept(FfiItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return classPath;
    }

    @Override
    public boolean isSourceItem() {
        return true;
    }
}
