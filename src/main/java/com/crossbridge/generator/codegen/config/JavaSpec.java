package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.JavaIdentStyle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the Java backend.
 */
@Value
@Builder(toBuilder = true)
public class JavaSpec {

    Path outFolder;
    String packageName;
    @NonNull @Builder.Default JavaAccessModifier classAccessModifier = JavaAccessModifier.PUBLIC;
    @NonNull @Builder.Default JavaIdentStyle identStyle = JavaIdentStyle.defaults();

    /**
     * Exception class thrown for C++ exceptions crossing into Java.
     */
    String cppException;
    String annotation;
    boolean generateInterfaces;
    String nullableAnnotation;
    String nonnullAnnotation;
    boolean implementAndroidOsParcelable;
    @Builder.Default boolean useFinalForRecord = true;

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<String> getPackageName() {
        return Optional.ofNullable(packageName);
    }

    public Optional<String> getCppException() {
        return Optional.ofNullable(cppException);
    }

    public Optional<String> getAnnotation() {
        return Optional.ofNullable(annotation);
    }

    public Optional<String> getNullableAnnotation() {
        return Optional.ofNullable(nullableAnnotation);
    }

    public Optional<String> getNonnullAnnotation() {
        return Optional.ofNullable(nonnullAnnotation);
    }
}
