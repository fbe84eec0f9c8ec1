package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.type.FinalType;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class SurfaceArgument {

    @NonNull
    String name;

    @NonNull
    FinalType type;
}
