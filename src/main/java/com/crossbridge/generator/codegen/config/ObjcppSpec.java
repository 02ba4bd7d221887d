package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the Objective-C++ glue backend.
 */
@Value
@Builder(toBuilder = true)
public class ObjcppSpec {

    Path outFolder;
    Path headerOutFolder;
    @NonNull @Builder.Default String ext = "mm";
    @NonNull @Builder.Default String includePrefix = "";
    @NonNull @Builder.Default String includeCppPrefix = "";
    @NonNull @Builder.Default String includeObjcPrefix = "";
    @NonNull @Builder.Default String namespace = "objc_generated";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<Path> getHeaderOutFolder() {
        return Optional.ofNullable(headerOutFolder);
    }
}
