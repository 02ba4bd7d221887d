package com.crossbridge.generator.codegen.render;

import java.nio.file.Path;

import com.crossbridge.generator.codegen.ident.IdentConverter;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Where and how a C++-family backend lays out its header/source files.
 */
@Value
@Builder(toBuilder = true)
public class CppFileLayout {

    @NonNull
    Path folder;

    @NonNull
    @Builder.Default
    String namespace = "";

    @NonNull
    IdentConverter fileIdentStyle;

    /**
     * Prepended to the file name when a source file includes its own header.
     */
    @NonNull
    @Builder.Default
    String includePrefix = "";
}
