package com.crossbridge.generator.codegen.backend;

import com.crossbridge.generator.codegen.render.DeclarationGenerator;
import com.crossbridge.generator.codegen.render.GeneratorContext;

/**
 * Creates a backend's generator for one run.
 */
@FunctionalInterface
public interface BackendFactory {

    DeclarationGenerator create(GeneratorContext context);
}
