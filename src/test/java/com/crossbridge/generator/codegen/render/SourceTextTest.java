package com.crossbridge.generator.codegen.render;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class SourceTextTest {

    @Test
    void testHelpers() {
        assertThat(SourceText.preComma("")).isEmpty();
        assertThat(SourceText.preComma("b")).isEqualTo(", b");
        assertThat(SourceText.p("x")).isEqualTo("(x)");
        assertThat(SourceText.q("a.h")).isEqualTo("\"a.h\"");
        assertThat(SourceText.t("int")).isEqualTo("<int>");
    }

    @Test
    void testSkipFirst() {
        SkipFirst skipFirst = new SkipFirst();
        List<String> out = new ArrayList<>();

        for (String s : List.of("a", "b", "c")) {
            skipFirst.apply(() -> out.add(","));
            out.add(s);
        }

        assertThat(String.join("", out)).isEqualTo("a,b,c");
    }
}
