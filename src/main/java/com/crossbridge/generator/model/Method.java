package com.crossbridge.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Method of an {@link InterfaceDef}.
 */
@Value
@Builder(toBuilder = true)
public class Method {

    @NonNull
    Ident ident;

    @NonNull
    @Singular
    List<Field> params;

    /**
     * Return type expression; {@code null} for void methods.
     */
    String returnType;

    @NonNull
    @Builder.Default
    Doc doc = Doc.EMPTY;

    boolean isStatic;

    boolean isConst;

    public Optional<String> getReturnType() {
        return Optional.ofNullable(returnType);
    }
}
