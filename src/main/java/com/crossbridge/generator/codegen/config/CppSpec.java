package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.CppIdentStyle;
import com.crossbridge.generator.codegen.ident.IdentConverter;
import com.crossbridge.generator.codegen.ident.IdentStyle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the C++ backend. The backend is enabled iff {@code outFolder} is set.
 */
@Value
@Builder(toBuilder = true)
public class CppSpec {

    Path outFolder;

    /**
     * Where headers go; defaults to {@link #getOutFolder()}.
     */
    Path headerOutFolder;

    @NonNull @Builder.Default String includePrefix = "";
    @NonNull @Builder.Default String extendedRecordIncludePrefix = "";
    @NonNull @Builder.Default String namespace = "";
    @NonNull @Builder.Default CppIdentStyle identStyle = CppIdentStyle.defaults();
    @NonNull @Builder.Default IdentConverter fileIdentStyle = IdentStyle.UNDER_LOWER;
    @NonNull @Builder.Default String optionalTemplate = "std::optional";
    @NonNull @Builder.Default String optionalHeader = "<optional>";
    @Builder.Default boolean enumHashWorkaround = true;
    String nnHeader;
    String nnType;
    String nnCheckExpression;
    boolean useWideStrings;
    boolean omitDefaultRecordCtor;
    @NonNull @Builder.Default String ext = "cpp";
    @NonNull @Builder.Default String headerExt = "hpp";

    /**
     * JSON library the generated records serialize with, e.g. {@code nlohmann_json}.
     */
    String jsonSerialization;

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<Path> getHeaderOutFolder() {
        return headerOutFolder != null ? Optional.of(headerOutFolder) : getOutFolder();
    }

    public Optional<String> getNnHeader() {
        return Optional.ofNullable(nnHeader);
    }

    public Optional<String> getNnType() {
        return Optional.ofNullable(nnType);
    }

    public Optional<String> getNnCheckExpression() {
        return Optional.ofNullable(nnCheckExpression);
    }

    public Optional<String> getJsonSerialization() {
        return Optional.ofNullable(jsonSerialization);
    }
}
