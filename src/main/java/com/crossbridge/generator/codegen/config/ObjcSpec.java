package com.crossbridge.generator.codegen.config;

import java.nio.file.Path;
import java.util.Optional;

import com.crossbridge.generator.codegen.ident.IdentConverter;
import com.crossbridge.generator.codegen.ident.IdentStyle;
import com.crossbridge.generator.codegen.ident.ObjcIdentStyle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of the Objective-C backend, including the optional Swift bridging header.
 */
@Value
@Builder(toBuilder = true)
public class ObjcSpec {

    Path outFolder;

    /**
     * Separate header folder. Unlike C++, no header folder is created when this is unset.
     */
    Path headerOutFolder;

    @NonNull @Builder.Default ObjcIdentStyle identStyle = ObjcIdentStyle.defaults();
    @NonNull @Builder.Default IdentConverter fileIdentStyle = IdentStyle.CAMEL_UPPER;
    @NonNull @Builder.Default String headerExt = "h";
    @NonNull @Builder.Default String includePrefix = "";
    @NonNull @Builder.Default String extendedRecordIncludePrefix = "";
    boolean closedEnums;

    /**
     * Base name (without extension) of the Swift bridging header.
     */
    String swiftBridgingHeaderName;

    public Optional<Path> getOutFolder() {
        return Optional.ofNullable(outFolder);
    }

    public Optional<Path> getHeaderOutFolder() {
        return Optional.ofNullable(headerOutFolder);
    }

    /**
     * Folder headers actually land in: the header folder if set, the output folder otherwise.
     */
    public Optional<Path> getEffectiveHeaderFolder() {
        return headerOutFolder != null ? Optional.of(headerOutFolder) : getOutFolder();
    }

    public Optional<String> getSwiftBridgingHeaderName() {
        return Optional.ofNullable(swiftBridgingHeaderName);
    }
}
