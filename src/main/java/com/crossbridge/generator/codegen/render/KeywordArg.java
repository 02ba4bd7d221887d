package com.crossbridge.generator.codegen.render;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code name:value} part of a keyword-style call such as an Objective-C message send.
 */
@Value
public class KeywordArg {

    @NonNull
    String name;

    @NonNull
    String value;
}
