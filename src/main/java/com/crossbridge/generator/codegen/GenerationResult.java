package com.crossbridge.generator.codegen;

import java.util.List;
import java.util.Optional;

import com.crossbridge.generator.codegen.backend.Backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one generation run: either success, or the single message of the error that
 * stopped it.
 */
@Value
@Builder
public class GenerationResult {

    boolean success;
    String errorMessage;

    /**
     * Backends that completed, in run order.
     */
    @Singular("backendRun")
    List<Backend> backendsRun;

    /**
     * Paths claimed in the output manifest, including those of a dry run.
     */
    @Singular
    List<String> claimedFiles;

    public Optional<String> getError() {
        return Optional.ofNullable(errorMessage);
    }

    public static GenerationResult success(List<Backend> backendsRun, List<String> claimedFiles) {
        return GenerationResult.builder()
                .success(true)
                .backendsRun(backendsRun)
                .claimedFiles(claimedFiles)
                .build();
    }

    public static GenerationResult failure(String errorMessage, List<Backend> backendsRun, List<String> claimedFiles) {
        return GenerationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .backendsRun(backendsRun)
                .claimedFiles(claimedFiles)
                .build();
    }
}
