package com.crossbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Enum declaration body.
 */
@Value
@Builder(toBuilder = true)
public class EnumDef implements TypeDeclBody {

    @NonNull
    @Singular
    List<EnumOption> options;

    /**
     * Whether the options are meant to be OR-ed together.
     */
    boolean flags;

    @Override
    public void accept(TypeDeclVisitor visitor) {
        visitor.visit(this);
    }
}
