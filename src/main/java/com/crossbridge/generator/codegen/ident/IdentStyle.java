package com.crossbridge.generator.codegen.ident;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Built-in casing conventions.
 *
 * Declaration order is the precedence used by {@link IdentStyles#infer(String)}: the first style
 * whose probe is a suffix of the example wins.
 */
public enum IdentStyle implements IdentConverter {

    /** {@code foo_bar -> FooBar} */
    CAMEL_UPPER("FooBar") {
        @Override
        public String convert(String token) {
            return Arrays.stream(words(token))
                    .map(IdentStyle::firstUpper)
                    .collect(Collectors.joining());
        }
    },

    /** {@code foo_bar -> fooBar}; the first word keeps its leading case. */
    CAMEL_LOWER("fooBar") {
        @Override
        public String convert(String token) {
            String[] words = words(token);
            StringBuilder sb = new StringBuilder(words[0]);
            for (int i = 1; i < words.length; i++) {
                sb.append(firstUpper(words[i]));
            }
            return sb.toString();
        }
    },

    /** Identity. */
    UNDER_LOWER("foo_bar") {
        @Override
        public String convert(String token) {
            return token;
        }
    },

    /** {@code foo_bar -> Foo_Bar} */
    UNDER_UPPER("Foo_Bar") {
        @Override
        public String convert(String token) {
            return Arrays.stream(words(token))
                    .map(IdentStyle::firstUpper)
                    .collect(Collectors.joining(DELIMITER));
        }
    },

    /** {@code foo_bar -> FOO_BAR} */
    UNDER_CAPS("FOO_BAR") {
        @Override
        public String convert(String token) {
            return token.toUpperCase(Locale.ROOT);
        }
    };

    public static final String DELIMITER = "_";

    private final String probe;

    IdentStyle(String probe) {
        this.probe = probe;
    }

    /**
     * What this style makes of the canonical token {@code foo_bar}.
     */
    public String getProbe() {
        return probe;
    }

    private static String[] words(String token) {
        // -1 keeps empty words so leading, trailing and doubled delimiters survive
        return token.split(DELIMITER, -1);
    }

    static String firstUpper(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
