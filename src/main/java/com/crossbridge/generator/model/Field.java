package com.crossbridge.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A record field or a method parameter.
 */
@Value
@Builder(toBuilder = true)
public class Field {

    @NonNull
    Ident ident;

    /**
     * Resolved IDL type expression, e.g. {@code list<string>}.
     */
    @NonNull
    String type;

    @NonNull
    @Builder.Default
    Doc doc = Doc.EMPTY;

    public static Field of(String name, String type) {
        return Field.builder().ident(Ident.of(name)).type(type).build();
    }
}
