package com.crossbridge.generator.codegen.ident;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifier styles for generated Objective-C code.
 */
@Value
@Builder(toBuilder = true)
public class ObjcIdentStyle {

    @NonNull IdentConverter type;
    @NonNull IdentConverter typeParam;
    @NonNull IdentConverter method;
    @NonNull IdentConverter field;
    @NonNull IdentConverter local;
    @NonNull IdentConverter enumMember;
    @NonNull IdentConverter constant;

    public static ObjcIdentStyle defaults() {
        return ObjcIdentStyle.builder()
                .type(IdentStyle.CAMEL_UPPER)
                .typeParam(IdentStyle.CAMEL_UPPER)
                .method(IdentStyle.CAMEL_LOWER)
                .field(IdentStyle.CAMEL_LOWER)
                .local(IdentStyle.CAMEL_LOWER)
                .enumMember(IdentStyle.CAMEL_UPPER)
                .constant(IdentStyle.CAMEL_UPPER)
                .build();
    }
}
