package com.crossbridge.generator.codegen.backend;

import java.nio.file.Path;
import java.util.List;

import com.crossbridge.generator.codegen.config.ObjcSpec;
import com.crossbridge.generator.codegen.output.IndentWriter;
import com.crossbridge.generator.codegen.render.DeclarationGenerator;
import com.crossbridge.generator.codegen.render.GeneratorContext;
import com.crossbridge.generator.codegen.render.SourceFileTemplates;
import com.crossbridge.generator.codegen.render.SourceText;
import com.crossbridge.generator.model.Doc;
import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.Ident;
import com.crossbridge.generator.model.InterfaceDef;
import com.crossbridge.generator.model.RecordDef;
import com.crossbridge.generator.model.TypeParam;

/**
 * Adds one {@code #import} per generated Objective-C header to the Swift bridging header.
 *
 * The header itself, with its preamble, is created by the orchestrator before this generator
 * runs; this class only appends to it.
 */
public class SwiftBridgingHeaderGenerator implements DeclarationGenerator {

    public static final String HEADER_EXT = "h";

    private final GeneratorContext context;
    private final ObjcSpec objc;

    public SwiftBridgingHeaderGenerator(GeneratorContext context) {
        this.context = context;
        this.objc = context.getSpec().getObjc();
    }

    public static String headerFileName(String bridgingHeaderName) {
        return bridgingHeaderName + "." + HEADER_EXT;
    }

    public static void writeAutogenerationWarning(IndentWriter w, String bridgingHeaderName) {
        w.wl(SourceFileTemplates.AUTOGENERATED_WARNING);
        w.wl("// This file is the Swift bridging header " + headerFileName(bridgingHeaderName));
        w.wl();
    }

    /**
     * Framework version symbols Xcode expects in an umbrella header.
     */
    public static void writeBridgingVars(IndentWriter w, String bridgingHeaderName) {
        w.wl("#import <Foundation/Foundation.h>");
        w.wl();
        w.wl("//! Project version number for " + bridgingHeaderName + ".");
        w.wl("FOUNDATION_EXPORT double " + bridgingHeaderName + "VersionNumber;");
        w.wl();
        w.wl("//! Project version string for " + bridgingHeaderName + ".");
        w.wl("FOUNDATION_EXPORT const unsigned char " + bridgingHeaderName + "VersionString[];");
        w.wl();
    }

    @Override
    public void generateEnum(String origin, Ident ident, Doc doc, EnumDef enumDef) {
        addImport(ident);
    }

    @Override
    public void generateRecord(String origin, Ident ident, Doc doc, List<TypeParam> params, RecordDef recordDef) {
        addImport(ident);
    }

    @Override
    public void generateInterface(String origin, Ident ident, Doc doc, List<TypeParam> params, InterfaceDef interfaceDef) {
        addImport(ident);
    }

    private void addImport(Ident ident) {
        Path folder = objc.getEffectiveHeaderFolder().orElseThrow();
        String bridgingHeader = headerFileName(objc.getSwiftBridgingHeaderName().orElseThrow());
        String header = objc.getIncludePrefix()
                + objc.getFileIdentStyle().convert(ident.getName()) + "." + objc.getHeaderExt();
        context.getFiles().appendToFile(folder, bridgingHeader, w -> w.wl("#import " + SourceText.q(header)));
    }
}
