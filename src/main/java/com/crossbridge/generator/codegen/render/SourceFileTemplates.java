package com.crossbridge.generator.codegen.render;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

import com.crossbridge.generator.codegen.config.GeneratorSpec;
import com.crossbridge.generator.codegen.output.FileEmitter;
import com.crossbridge.generator.codegen.output.IndentWriter;

/**
 * Generic C++-family header and source files: autogeneration banner, includes and a
 * namespace-wrapped body. Backends supply the declarations.
 */
public class SourceFileTemplates {

    public static final String AUTOGENERATED_WARNING = "// AUTOGENERATED FILE - DO NOT MODIFY!";

    private final GeneratorSpec spec;
    private final FileEmitter files;
    private final CodeRenderer renderer;

    public SourceFileTemplates(GeneratorSpec spec, FileEmitter files, CodeRenderer renderer) {
        this.spec = spec;
        this.files = files;
        this.renderer = renderer;
    }

    public static void writeBanner(IndentWriter w, String origin) {
        w.wl(AUTOGENERATED_WARNING);
        w.wl("// This file was generated from " + origin);
    }

    /**
     * Writes {@code <fileIdentStyle(name)>.<headerExt>}.
     *
     * @param includes complete include lines, in order
     * @param forwardDecls forward declarations, written at the top of the namespace
     * @param body declarations inside the namespace
     * @param trailer text after the namespace, e.g. {@code std::hash} specializations
     */
    public void writeHppFile(CppFileLayout layout, String name, String origin,
                             Collection<String> includes, Collection<String> forwardDecls,
                             Consumer<IndentWriter> body, Consumer<IndentWriter> trailer) {
        writeHpp(layout, name, origin, includes, Map.of(), forwardDecls, body, trailer);
    }

    /**
     * Variant taking the header's references: imports become sorted, distinct {@code #include}
     * lines; declarations for the file's own namespace are forward-declared inside it, those for
     * other namespaces in a block of their own ahead of it.
     */
    public void writeHppFile(CppFileLayout layout, String name, String origin,
                             Collection<SymbolReference> refs,
                             Consumer<IndentWriter> body, Consumer<IndentWriter> trailer) {
        Set<String> includes = new TreeSet<>();
        Set<String> ownDecls = new LinkedHashSet<>();
        Map<String, Set<String>> foreignDecls = new LinkedHashMap<>();
        for (SymbolReference ref : refs) {
            ref.accept(new SymbolReference.Visitor<Void>() {
                @Override
                public Void visitImport(SymbolReference.ImportRef importRef) {
                    includes.add("#include " + importRef.getArg());
                    return null;
                }

                @Override
                public Void visitDecl(SymbolReference.DeclRef declRef) {
                    String ns = declRef.getNamespace().orElse(layout.getNamespace());
                    if (ns.equals(layout.getNamespace())) {
                        ownDecls.add(declRef.getDecl());
                    } else {
                        foreignDecls.computeIfAbsent(ns, k -> new LinkedHashSet<>()).add(declRef.getDecl());
                    }
                    return null;
                }
            });
        }
        writeHpp(layout, name, origin, includes, foreignDecls, ownDecls, body, trailer);
    }

    private void writeHpp(CppFileLayout layout, String name, String origin,
                          Collection<String> includes, Map<String, ? extends Collection<String>> foreignDecls,
                          Collection<String> forwardDecls,
                          Consumer<IndentWriter> body, Consumer<IndentWriter> trailer) {
        String fileName = layout.getFileIdentStyle().convert(name) + "." + spec.getCpp().getHeaderExt();
        files.createFile(layout.getFolder(), fileName, w -> {
            writeBanner(w, origin);
            w.wl();
            w.wl("#pragma once");
            if (!includes.isEmpty()) {
                w.wl();
                includes.forEach(w::wl);
            }
            w.wl();
            foreignDecls.forEach((ns, decls) -> {
                renderer.wrapNamespace(w, ns, inner -> decls.forEach(inner::wl));
                w.wl();
            });
            renderer.wrapNamespace(w, layout.getNamespace(), inner -> {
                if (!forwardDecls.isEmpty()) {
                    forwardDecls.forEach(inner::wl);
                    inner.wl();
                }
                body.accept(inner);
            });
            trailer.accept(w);
        });
    }

    /**
     * Writes {@code <fileIdentStyle(name)>.<ext>}, which includes its own header first. An
     * include line equal to the own-header include is not repeated.
     */
    public void writeCppFile(CppFileLayout layout, String name, String origin,
                             Collection<String> includes, Consumer<IndentWriter> body) {
        String baseName = layout.getFileIdentStyle().convert(name);
        files.createFile(layout.getFolder(), baseName + "." + spec.getCpp().getExt(), w -> {
            writeBanner(w, origin);
            w.wl();
            String myHeader = SourceText.q(layout.getIncludePrefix() + baseName + "." + spec.getCpp().getHeaderExt());
            String myHeaderInclude = "#include " + myHeader;
            w.wl(myHeaderInclude + "  // my header");
            includes.stream()
                    .filter(include -> !include.equals(myHeaderInclude))
                    .forEach(w::wl);
            w.wl();
            renderer.wrapNamespace(w, layout.getNamespace(), body);
        });
    }
}
