package com.crossbridge.generator.codegen.ident;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifier styles for generated C++/CLI code, including property and file names.
 */
@Value
@Builder(toBuilder = true)
public class CppCliIdentStyle {

    @NonNull IdentConverter type;
    @NonNull IdentConverter typeParam;
    @NonNull IdentConverter property;
    @NonNull IdentConverter method;
    @NonNull IdentConverter field;
    @NonNull IdentConverter local;
    @NonNull IdentConverter enumMember;
    @NonNull IdentConverter constant;
    @NonNull IdentConverter file;

    public static CppCliIdentStyle defaults() {
        return CppCliIdentStyle.builder()
                .type(IdentStyle.CAMEL_UPPER)
                .typeParam(IdentStyle.CAMEL_UPPER)
                .property(IdentStyle.CAMEL_UPPER)
                .method(IdentStyle.CAMEL_UPPER)
                .field(IdentStyles.withPrefix("_", IdentStyle.CAMEL_LOWER))
                .local(IdentStyle.CAMEL_LOWER)
                .enumMember(IdentStyle.CAMEL_UPPER)
                .constant(IdentStyle.CAMEL_UPPER)
                .file(IdentStyle.CAMEL_UPPER)
                .build();
    }
}
