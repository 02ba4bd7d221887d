package com.crossbridge.generator.codegen.backend;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.crossbridge.generator.codegen.config.GeneratorSpec;

/**
 * The generation targets, declared in the order they run.
 */
public enum Backend {

    CPP("C++", spec -> spec.getCpp().getOutFolder(),
            spec -> folders(
                    "C++", spec.getCpp().getOutFolder(),
                    "C++ header", spec.getCpp().getHeaderOutFolder())),

    JAVA("Java", spec -> spec.getJavaSpec().getOutFolder(),
            spec -> folders("Java", spec.getJavaSpec().getOutFolder())),

    JNI("JNI", spec -> spec.getJni().getOutFolder(),
            spec -> folders(
                    "JNI C++", spec.getJni().getOutFolder(),
                    "JNI C++ header", spec.getJni().getHeaderOutFolder())),

    OBJC("Objective-C", spec -> spec.getObjc().getOutFolder(),
            spec -> folders(
                    "Objective-C", spec.getObjc().getOutFolder(),
                    "Objective-C header", spec.getObjc().getHeaderOutFolder())),

    OBJCPP("Objective-C++", spec -> spec.getObjcpp().getOutFolder(),
            spec -> folders(
                    "Objective-C++", spec.getObjcpp().getOutFolder(),
                    "Objective-C++ header", spec.getObjcpp().getHeaderOutFolder())),

    /**
     * Runs only when Objective-C output and a bridging header name are both configured.
     * Writes into the Objective-C header folder, which {@link #OBJC} has already created.
     */
    SWIFT_BRIDGING_HEADER("Swift bridging header",
            spec -> spec.getObjc().getSwiftBridgingHeaderName().isPresent()
                    ? spec.getObjc().getEffectiveHeaderFolder()
                    : Optional.empty(),
            spec -> List.of()),

    CPP_CLI("C++/CLI", spec -> spec.getCppCli().getOutFolder(),
            spec -> folders("C++/CLI", spec.getCppCli().getOutFolder())),

    YAML("YAML", spec -> spec.getYaml().getOutFolder(),
            spec -> folders("YAML", spec.getYaml().getOutFolder())),

    PYTHON("Python", spec -> spec.getPython().getOutFolder(),
            spec -> folders("Python", spec.getPython().getOutFolder())),

    C_WRAPPER("C wrapper", spec -> spec.getCWrapper().getOutFolder(),
            spec -> folders(
                    "C", spec.getCWrapper().getOutFolder(),
                    "C header", spec.getCWrapper().getHeaderOutFolder())),

    CFFI("Cffi", spec -> spec.getCffi().getOutFolder(),
            spec -> folders("Cffi", spec.getCffi().getOutFolder()));

    private final String displayName;
    private final Function<GeneratorSpec, Optional<Path>> primaryFolder;
    private final Function<GeneratorSpec, List<OutputFolder>> folders;

    Backend(String displayName,
            Function<GeneratorSpec, Optional<Path>> primaryFolder,
            Function<GeneratorSpec, List<OutputFolder>> folders) {
        this.displayName = displayName;
        this.primaryFolder = primaryFolder;
        this.folders = folders;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isEnabled(GeneratorSpec spec) {
        return primaryFolder.apply(spec).isPresent();
    }

    /**
     * Folders to create before this backend runs; unset optional folders are left out.
     */
    public List<OutputFolder> getFolders(GeneratorSpec spec) {
        return folders.apply(spec);
    }

    private static List<OutputFolder> folders(String label, Optional<Path> folder) {
        return folder.map(p -> List.of(new OutputFolder(label, p))).orElse(List.of());
    }

    private static List<OutputFolder> folders(String label, Optional<Path> folder,
                                              String secondLabel, Optional<Path> second) {
        List<OutputFolder> result = new ArrayList<>(folders(label, folder));
        result.addAll(folders(secondLabel, second));
        return result;
    }
}
