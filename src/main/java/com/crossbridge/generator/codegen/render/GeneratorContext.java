package com.crossbridge.generator.codegen.render;

import com.crossbridge.generator.codegen.config.GeneratorSpec;
import com.crossbridge.generator.codegen.ident.CppCliIdentStyle;
import com.crossbridge.generator.codegen.ident.CppIdentStyle;
import com.crossbridge.generator.codegen.ident.JavaIdentStyle;
import com.crossbridge.generator.codegen.ident.ObjcIdentStyle;
import com.crossbridge.generator.codegen.ident.PythonIdentStyle;
import com.crossbridge.generator.codegen.output.FileEmitter;
import com.crossbridge.generator.codegen.output.GenerationSession;

import lombok.Getter;
import lombok.NonNull;

/**
 * Everything a backend needs to generate one run: the configuration, the session's file
 * emitter and the shared rendering helpers.
 */
@Getter
public class GeneratorContext {

    @NonNull
    private final GeneratorSpec spec;

    @NonNull
    private final GenerationSession session;

    private final FileEmitter files;
    private final CodeRenderer renderer;
    private final SourceFileTemplates templates;

    public GeneratorContext(@NonNull GeneratorSpec spec, @NonNull GenerationSession session) {
        this.spec = spec;
        this.session = session;
        this.files = new FileEmitter(spec, session);
        this.renderer = new CodeRenderer(spec);
        this.templates = new SourceFileTemplates(spec, files, renderer);
    }

    public CppIdentStyle getIdCpp() {
        return spec.getCpp().getIdentStyle();
    }

    public JavaIdentStyle getIdJava() {
        return spec.getJavaSpec().getIdentStyle();
    }

    public ObjcIdentStyle getIdObjc() {
        return spec.getObjc().getIdentStyle();
    }

    public PythonIdentStyle getIdPython() {
        return spec.getPython().getIdentStyle();
    }

    public CppCliIdentStyle getIdCppCli() {
        return spec.getCppCli().getIdentStyle();
    }
}
