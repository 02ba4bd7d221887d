package com.crossbridge.generator.codegen.backend;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * A folder a backend writes into, with the label used in error messages.
 */
@Value
public class OutputFolder {

    @NonNull
    String label;

    @NonNull
    Path path;
}
