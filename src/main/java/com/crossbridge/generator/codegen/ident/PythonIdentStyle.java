package com.crossbridge.generator.codegen.ident;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifier styles for generated Python code. {@code type} names the module-level helpers,
 * {@code className} the Python classes wrapping them.
 */
@Value
@Builder(toBuilder = true)
public class PythonIdentStyle {

    @NonNull IdentConverter type;
    @NonNull IdentConverter className;
    @NonNull IdentConverter typeParam;
    @NonNull IdentConverter method;
    @NonNull IdentConverter field;
    @NonNull IdentConverter local;
    @NonNull IdentConverter enumMember;
    @NonNull IdentConverter constant;

    public static PythonIdentStyle defaults() {
        return PythonIdentStyle.builder()
                .type(IdentStyle.UNDER_LOWER)
                .className(IdentStyle.CAMEL_UPPER)
                .typeParam(IdentStyle.UNDER_LOWER)
                .method(IdentStyle.UNDER_LOWER)
                .field(IdentStyle.UNDER_LOWER)
                .local(IdentStyle.UNDER_LOWER)
                .enumMember(IdentStyle.UNDER_UPPER)
                .constant(IdentStyle.UNDER_CAPS)
                .build();
    }
}
