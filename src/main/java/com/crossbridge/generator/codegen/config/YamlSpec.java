package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class YamlSpec {

    Path outFolder;

    /**
     * Single output file for all declarations; one file per declaration when unset.
     */
    String outFile;

    @NonNull @Builder.Default String prefix = "";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<String> getOutFile() {
        return Optional.ofNullable(outFile);
    }
}
