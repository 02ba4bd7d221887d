package com.crossbridge.generator.codegen.render;

import java.util.OptionalLong;

import com.crossbridge.generator.model.EnumOption;

import lombok.NonNull;
import lombok.Value;

/**
 * An enum option in emission order together with its explicit value, if it has one.
 */
@Value
public class EnumOptionEntry {

    @NonNull
    EnumOption option;

    /**
     * Zero-based position among the ordinary options, -1 for NoFlags/AllFlags options.
     */
    int ordinal;

    /**
     * {@code null} for ordinary options of a non-flags enum, which get no explicit value.
     */
    Long value;

    public OptionalLong getValue() {
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public String getName() {
        return option.getIdent().getName();
    }
}
