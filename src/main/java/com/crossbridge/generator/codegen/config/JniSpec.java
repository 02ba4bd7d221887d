package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.IdentConverter;
import com.crossbridge.generator.codegen.ident.IdentStyle;
import com.crossbridge.generator.codegen.ident.IdentStyles;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the JNI glue backend.
 */
@Value
@Builder(toBuilder = true)
public class JniSpec {

    Path outFolder;
    Path headerOutFolder;
    @NonNull @Builder.Default String includePrefix = "";
    @NonNull @Builder.Default String includeCppPrefix = "";
    @NonNull @Builder.Default String namespace = "jni_generated";
    @NonNull @Builder.Default IdentConverter classIdentStyle = IdentStyles.withPrefix("Native", IdentStyle.CAMEL_UPPER);
    @NonNull @Builder.Default IdentConverter fileIdentStyle = IdentStyles.withPrefix("Native", IdentStyle.CAMEL_UPPER);
    @Builder.Default boolean generateMain = true;

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<Path> getHeaderOutFolder() {
        return headerOutFolder != null ? Optional.of(headerOutFolder) : getOutFolder();
    }
}
