package com.crossbridge.generator.codegen.ident;

/**
 * Pure transform from a canonical {@code snake_case} token to a target casing convention.
 */
@FunctionalInterface
public interface IdentConverter {

    String convert(String token);
}
