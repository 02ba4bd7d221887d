package com.crossbridge.generator.codegen.ident;

import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Entry points of the identifier style engine.
 */
@UtilityClass
public class IdentStyles {

    public static String camelUpper(String token) {
        return IdentStyle.CAMEL_UPPER.convert(token);
    }

    public static String camelLower(String token) {
        return IdentStyle.CAMEL_LOWER.convert(token);
    }

    public static String identity(String token) {
        return IdentStyle.UNDER_LOWER.convert(token);
    }

    public static String underscoreCap(String token) {
        return IdentStyle.UNDER_UPPER.convert(token);
    }

    public static String allCaps(String token) {
        return IdentStyle.UNDER_CAPS.convert(token);
    }

    public static String firstUpper(String token) {
        return IdentStyle.firstUpper(token);
    }

    public static IdentConverter withPrefix(String prefix, IdentConverter base) {
        return new PrefixedIdentStyle(prefix, base);
    }

    /**
     * Infers the style (and literal prefix) that turns {@code foo_bar} into a name ending like
     * {@code example}. {@code "mFooBar"} gives {@code withPrefix("m", CAMEL_UPPER)}.
     *
     * @param example a name written in the wanted style for the token {@code foo_bar}
     * @return the inferred style, or empty if no built-in style matches
     */
    public static Optional<IdentConverter> infer(String example) {
        for (IdentStyle style : IdentStyle.values()) {
            String probe = style.getProbe();
            if (example.endsWith(probe)) {
                String prefix = example.substring(0, example.length() - probe.length());
                return Optional.of(prefix.isEmpty() ? style : withPrefix(prefix, style));
            }
        }
        return Optional.empty();
    }

    public static IdentConverter inferOrThrow(String example) {
        return infer(example).orElseThrow(() -> new IllegalArgumentException(
                "Unable to infer identifier style from \"" + example + "\"; expected a name ending in one of "
                        + "FooBar, fooBar, foo_bar, Foo_Bar or FOO_BAR"));
    }
}
