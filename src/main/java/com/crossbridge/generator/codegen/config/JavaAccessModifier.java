package com.crossbridge.generator.codegen.config;

import java.util.Arrays;
import java.util.Locale;

/**
 * Access modifier of generated Java classes.
 */
public enum JavaAccessModifier {
    PUBLIC("public", "public "),
    PACKAGE("package", "/*package*/ ");

    private final String optionValue;
    private final String codeGenerationString;

    JavaAccessModifier(String optionValue, String codeGenerationString) {
        this.optionValue = optionValue;
        this.codeGenerationString = codeGenerationString;
    }

    public String getOptionValue() {
        return optionValue;
    }

    /**
     * Text emitted in front of a class declaration, trailing space included.
     */
    public String getCodeGenerationString() {
        return codeGenerationString;
    }

    public static JavaAccessModifier fromOptionValue(String value) {
        return Arrays.stream(values())
                .filter(m -> m.optionValue.equals(value.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown Java access modifier: " + value));
    }
}
