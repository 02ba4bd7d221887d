package com.crossbridge.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Doc comment attached to a declaration. Lines are kept verbatim, including leading spaces.
 */
@Value
@Builder(toBuilder = true)
public class Doc {

    public static final Doc EMPTY = new Doc(List.of());

    @NonNull
    @Builder.Default
    List<String> lines = List.of();

    public static Doc of(String... lines) {
        return new Doc(List.of(lines));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
