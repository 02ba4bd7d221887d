package com.crossbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A top-level, type-checked IDL declaration as handed over by the parser.
 */
@Value
@Builder(toBuilder = true)
public class TypeDecl {

    @NonNull
    Ident ident;

    @NonNull
    @Singular
    List<TypeParam> params;

    @NonNull
    TypeDeclBody body;

    @NonNull
    @Builder.Default
    Doc doc = Doc.EMPTY;

    /**
     * Human-readable provenance, usually the IDL file name.
     */
    @NonNull
    String origin;

    /**
     * Declarations pulled in from an imported module are type-checked but never generated.
     */
    boolean imported;
}
