package com.crossbridge.generator.codegen.ident;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifier styles for generated C++ code. Enum types get their own role since C++ code
 * often names them differently from classes.
 */
@Value
@Builder(toBuilder = true)
public class CppIdentStyle {

    @NonNull IdentConverter type;
    @NonNull IdentConverter enumType;
    @NonNull IdentConverter typeParam;
    @NonNull IdentConverter method;
    @NonNull IdentConverter field;
    @NonNull IdentConverter local;
    @NonNull IdentConverter enumMember;
    @NonNull IdentConverter constant;

    public static CppIdentStyle defaults() {
        return CppIdentStyle.builder()
                .type(IdentStyle.CAMEL_UPPER)
                .enumType(IdentStyle.CAMEL_UPPER)
                .typeParam(IdentStyle.CAMEL_UPPER)
                .method(IdentStyle.UNDER_LOWER)
                .field(IdentStyle.UNDER_LOWER)
                .local(IdentStyle.UNDER_LOWER)
                .enumMember(IdentStyle.UNDER_CAPS)
                .constant(IdentStyle.UNDER_CAPS)
                .build();
    }
}
