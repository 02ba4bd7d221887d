package com.crossbridge.generator.codegen.ident;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifier styles for generated Java code.
 */
@Value
@Builder(toBuilder = true)
public class JavaIdentStyle {

    @NonNull IdentConverter type;
    @NonNull IdentConverter typeParam;
    @NonNull IdentConverter method;
    @NonNull IdentConverter field;
    @NonNull IdentConverter local;
    @NonNull IdentConverter enumMember;
    @NonNull IdentConverter constant;

    public static JavaIdentStyle defaults() {
        return JavaIdentStyle.builder()
                .type(IdentStyle.CAMEL_UPPER)
                .typeParam(IdentStyle.CAMEL_UPPER)
                .method(IdentStyle.CAMEL_LOWER)
                .field(IdentStyle.CAMEL_LOWER)
                .local(IdentStyle.CAMEL_LOWER)
                .enumMember(IdentStyle.UNDER_CAPS)
                .constant(IdentStyle.UNDER_CAPS)
                .build();
    }
}
