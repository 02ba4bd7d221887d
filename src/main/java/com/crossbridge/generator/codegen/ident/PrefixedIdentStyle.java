package com.crossbridge.generator.codegen.ident;

import lombok.NonNull;
import lombok.Value;

/**
 * A literal prefix followed by the output of a base style, e.g. {@code m} + camelUpper for
 * {@code mFooBar} member names.
 */
@Value
public class PrefixedIdentStyle implements IdentConverter {

    @NonNull
    String prefix;

    @NonNull
    IdentConverter base;

    @Override
    public String convert(String token) {
        return prefix + base.convert(token);
    }
}
