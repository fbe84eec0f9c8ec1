package com.ffibind.generator.model.declaration;

import lombok.NonNull;
import lombok.Value;

/**
 * A native type as spelled in the declaration, e.g. {@code const QString&}.
 */
@Value(staticConstructor = "of")
public class NativeType {

    @NonNull
    String spelling;

    @Override
    public String toString() {
        return spelling;
    }
}
