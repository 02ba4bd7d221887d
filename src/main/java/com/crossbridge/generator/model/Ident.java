package com.crossbridge.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Canonical identifier of a declaration, option, field or parameter as written in the IDL.
 *
 * The canonical form is lower-case words separated by underscores. Call sites convert
 * to text explicitly through {@link #getName()}.
 */
@Value
@Builder(toBuilder = true)
public class Ident {

    @NonNull
    String name;

    public static Ident of(String name) {
        return Ident.builder().name(name).build();
    }
}
