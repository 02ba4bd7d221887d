package com.crossbridge.generator.codegen.output;

import com.crossbridge.generator.codegen.config.GeneratorSpec;

import lombok.Getter;

/**
 * Mutable state of exactly one generation run: the written-file registry and the output
 * manifest. Create one per run and share it with every backend of that run; a session reused
 * across runs reports collisions with files of the earlier run.
 */
@Getter
public class GenerationSession {

    private final WrittenFileRegistry writtenFiles;
    private final OutputManifest manifest;

    public GenerationSession(WrittenFileRegistry writtenFiles, OutputManifest manifest) {
        this.writtenFiles = writtenFiles;
        this.manifest = manifest;
    }

    public static GenerationSession open(GeneratorSpec spec) {
        return new GenerationSession(
                new WrittenFileRegistry(),
                new OutputManifest(spec.getOutFileListWriter().orElse(null)));
    }
}
