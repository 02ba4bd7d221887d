package com.crossbridge.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crossbridge.generator.codegen.backend.Backend;
import com.crossbridge.generator.codegen.backend.BackendFactory;
import com.crossbridge.generator.codegen.backend.BackendRegistry;
import com.crossbridge.generator.codegen.backend.OutputFolder;
import com.crossbridge.generator.codegen.backend.SwiftBridgingHeaderGenerator;
import com.crossbridge.generator.codegen.config.GeneratorSpec;
import com.crossbridge.generator.codegen.output.GenerationSession;
import com.crossbridge.generator.codegen.output.OutputFolders;
import com.crossbridge.generator.codegen.render.DeclarationDispatcher;
import com.crossbridge.generator.codegen.render.DeclarationGenerator;
import com.crossbridge.generator.codegen.render.GeneratorContext;
import com.crossbridge.generator.model.TypeDecl;

/**
 * Runs every enabled backend over the declarations, in {@link Backend} order.
 *
 * Each call to {@link #generate(List)} is one session with its own written-file registry and
 * output manifest. The first {@link GenerateException} stops the run and becomes the result's
 * error message; files written by earlier backends stay on disk.
 */
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final GeneratorSpec spec;
    private final BackendRegistry registry;

    public GenerationOrchestrator(GeneratorSpec spec, BackendRegistry registry) {
        this.spec = spec;
        this.registry = registry;
    }

    public GenerationResult generate(List<TypeDecl> idl) {
        GenerationSession session = GenerationSession.open(spec);
        GeneratorContext context = new GeneratorContext(spec, session);
        List<Backend> backendsRun = new ArrayList<>();

        if (spec.isSkipGeneration()) {
            log.info("Dry run: output paths are listed but no files are written");
        }

        try {
            for (Backend backend : Backend.values()) {
                if (!backend.isEnabled(spec)) {
                    continue;
                }
                log.info("Generating {}...", backend.getDisplayName());

                if (!spec.isSkipGeneration()) {
                    for (OutputFolder folder : backend.getFolders(spec)) {
                        OutputFolders.createFolder(folder.getLabel(), folder.getPath());
                    }
                }
                if (backend == Backend.SWIFT_BRIDGING_HEADER) {
                    createSwiftBridgingHeader(context);
                }

                DeclarationGenerator generator = createGenerator(backend, context);
                int generated = DeclarationDispatcher.generate(idl, generator);
                log.debug("{}: {} declarations", backend.getDisplayName(), generated);
                backendsRun.add(backend);
            }
            session.getManifest().flush();
        } catch (GenerateException e) {
            log.error("Generation failed: {}", e.getMessage());
            flushAfterFailure(session, e);
            return GenerationResult.failure(e.getMessage(), backendsRun, session.getManifest().getPaths());
        }

        log.info("Generation complete: {} backends, {} files", backendsRun.size(),
                session.getManifest().getPaths().size());
        return GenerationResult.success(backendsRun, session.getManifest().getPaths());
    }

    /**
     * Paths claimed before the failure still reach the output file list.
     */
    private static void flushAfterFailure(GenerationSession session, GenerateException failure) {
        try {
            session.getManifest().flush();
        } catch (GenerateException flushFailure) {
            log.warn("Output file list may be incomplete: {}", flushFailure.getMessage());
            failure.addSuppressed(flushFailure);
        }
    }

    private DeclarationGenerator createGenerator(Backend backend, GeneratorContext context) {
        BackendFactory factory = registry.find(backend)
                .orElseThrow(() -> new GenerateException(
                        "No generator registered for the " + backend.getDisplayName() + " backend."));
        return factory.create(context);
    }

    private void createSwiftBridgingHeader(GeneratorContext context) {
        String name = spec.getObjc().getSwiftBridgingHeaderName().orElseThrow();
        Path folder = spec.getObjc().getEffectiveHeaderFolder().orElseThrow();
        context.getFiles().createFile(folder, SwiftBridgingHeaderGenerator.headerFileName(name), w -> {
            SwiftBridgingHeaderGenerator.writeAutogenerationWarning(w, name);
            SwiftBridgingHeaderGenerator.writeBridgingVars(w, name);
        });
    }
}
