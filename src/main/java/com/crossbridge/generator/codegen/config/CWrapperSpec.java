package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CWrapperSpec {

    Path outFolder;
    Path headerOutFolder;
    @NonNull @Builder.Default String includePrefix = "";
    @NonNull @Builder.Default String includeCppPrefix = "";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<Path> getHeaderOutFolder() {
        return headerOutFolder != null ? Optional.of(headerOutFolder) : getOutFolder();
    }
}
