package com.ffibind.generator.model.ffi;

import com.ffibind.generator.model.type.BindingType;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class FfiArgument {

    @NonNull
    String name;

    @NonNull
    BindingType type;

    @NonNull
    FfiArgumentRole role;
}
