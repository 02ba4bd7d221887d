package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the CFFI build-script backend wrapping the C wrapper for Python.
 */
@Value
@Builder(toBuilder = true)
public class CffiSpec {

    Path outFolder;
    @NonNull @Builder.Default String packageName = "";
    @NonNull @Builder.Default String dynamicLibList = "";
    @NonNull @Builder.Default String idlFileName = "";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }
}
