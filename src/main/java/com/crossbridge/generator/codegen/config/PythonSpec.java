package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.PythonIdentStyle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PythonSpec {

    Path outFolder;
    @NonNull @Builder.Default PythonIdentStyle identStyle = PythonIdentStyle.defaults();
    @NonNull @Builder.Default String importPrefix = "";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }
}
