package com.crossbridge.generator.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One option of an {@link EnumDef}.
 */
@Value
@Builder(toBuilder = true)
public class EnumOption {

    @NonNull
    Ident ident;

    @NonNull
    @Builder.Default
    Doc doc = Doc.EMPTY;

    SpecialFlag specialFlag;

    public Optional<SpecialFlag> getSpecialFlag() {
        return Optional.ofNullable(specialFlag);
    }

    public boolean isOrdinary() {
        return specialFlag == null;
    }

    public boolean is(SpecialFlag flag) {
        return specialFlag == flag;
    }

    public static EnumOption of(String name) {
        return EnumOption.builder().ident(Ident.of(name)).build();
    }

    public static EnumOption of(String name, SpecialFlag flag) {
        return EnumOption.builder().ident(Ident.of(name)).specialFlag(flag).build();
    }
}
