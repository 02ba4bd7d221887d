package com.crossbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Record (plain data) declaration body.
 */
@Value
@Builder(toBuilder = true)
public class RecordDef implements TypeDeclBody {

    @NonNull
    @Singular
    List<Field> fields;

    @Override
    public void accept(TypeDeclVisitor visitor) {
        visitor.visit(this);
    }
}
