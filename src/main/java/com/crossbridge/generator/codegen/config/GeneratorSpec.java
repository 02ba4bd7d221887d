package com.crossbridge.generator.codegen.config;

import java.io.Writer;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Complete, immutable configuration of one generation run.
 *
 * Built once before generation starts (typically from command-line options) and shared
 * read-only by every backend. A backend runs iff its output folder is set.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorSpec {

    @NonNull @Builder.Default CppSpec cpp = CppSpec.builder().build();
    // Java backend settings
    @NonNull @Builder.Default JavaSpec javaSpec = JavaSpec.builder().build();
    @NonNull @Builder.Default JniSpec jni = JniSpec.builder().build();
    @NonNull @Builder.Default ObjcSpec objc = ObjcSpec.builder().build();
    @NonNull @Builder.Default ObjcppSpec objcpp = ObjcppSpec.builder().build();
    @NonNull @Builder.Default CppCliSpec cppCli = CppCliSpec.builder().build();
    @NonNull @Builder.Default YamlSpec yaml = YamlSpec.builder().build();
    @NonNull @Builder.Default PythonSpec python = PythonSpec.builder().build();
    @NonNull @Builder.Default CffiSpec cffi = CffiSpec.builder().build();
    @NonNull @Builder.Default CWrapperSpec cWrapper = CWrapperSpec.builder().build();

    /**
     * Dry run: claim paths in the output file list but write nothing.
     */
    boolean skipGeneration;

    /**
     * Sink receiving every claimed output path, one per line.
     */
    Writer outFileListWriter;

    public Optional<Writer> getOutFileListWriter() {
        return Optional.ofNullable(outFileListWriter);
    }
}
