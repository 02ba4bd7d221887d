package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.CppCliIdentStyle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CppCliSpec {

    Path outFolder;
    @NonNull @Builder.Default CppCliIdentStyle identStyle = CppCliIdentStyle.defaults();
    @NonNull @Builder.Default String namespace = "";
    @NonNull @Builder.Default String includeCppPrefix = "";

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }
}
