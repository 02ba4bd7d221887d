package com.crossbridge.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Generic type parameter of a record or interface.
 */
@Value
public class TypeParam {

    @NonNull
    Ident ident;

    public static TypeParam of(String name) {
        return new TypeParam(Ident.of(name));
    }
}
