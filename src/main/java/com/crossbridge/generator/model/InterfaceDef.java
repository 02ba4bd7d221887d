package com.crossbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Interface declaration body.
 */
@Value
@Builder(toBuilder = true)
public class InterfaceDef implements TypeDeclBody {

    @NonNull
    @Singular
    List<Method> methods;

    @Override
    public void accept(TypeDeclVisitor visitor) {
        visitor.visit(this);
    }
}
