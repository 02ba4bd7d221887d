package com.crossbridge.generator.codegen.render;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.EnumOption;
import com.crossbridge.generator.model.SpecialFlag;

class EnumOptionLayoutTest {

    @Test
    void testFlagsValues() {
        EnumDef e = EnumDef.builder()
                .flags(true)
                .option(EnumOption.of("d", SpecialFlag.NO_FLAGS))
                .option(EnumOption.of("a"))
                .option(EnumOption.of("e", SpecialFlag.ALL_FLAGS))
                .option(EnumOption.of("b"))
                .option(EnumOption.of("c"))
                .build();

        assertThat(EnumOptionLayout.of(e))
                .extracting(EnumOptionEntry::getName, EnumOptionEntry::getOrdinal, entry -> entry.getValue().getAsLong())
                .containsExactly(
                        tuple("d", -1, 0L),
                        tuple("a", 0, 1L),
                        tuple("b", 1, 2L),
                        tuple("c", 2, 4L),
                        tuple("e", -1, 7L));
    }

    @Test
    void testPlainEnumHasNoValues() {
        EnumDef e = EnumDef.builder()
                .option(EnumOption.of("x"))
                .option(EnumOption.of("y"))
                .build();

        assertThat(EnumOptionLayout.of(e))
                .extracting(EnumOptionEntry::getName, EnumOptionEntry::getOrdinal)
                .containsExactly(tuple("x", 0), tuple("y", 1));
        assertThat(EnumOptionLayout.of(e)).allSatisfy(entry -> assertThat(entry.getValue()).isEmpty());
    }

    @Test
    void testAllFlagsAloneIsZero() {
        EnumDef e = EnumDef.builder()
                .flags(true)
                .option(EnumOption.of("all", SpecialFlag.ALL_FLAGS))
                .build();

        assertThat(EnumOptionLayout.of(e)).singleElement()
                .satisfies(entry -> assertThat(entry.getValue()).hasValue(0L));
    }

    @Test
    void testAllFlagsInPlainEnumIsZero() {
        EnumDef e = EnumDef.builder()
                .option(EnumOption.of("all", SpecialFlag.ALL_FLAGS))
                .option(EnumOption.of("x"))
                .option(EnumOption.of("y"))
                .build();

        assertThat(EnumOptionLayout.of(e))
                .extracting(EnumOptionEntry::getName, entry -> entry.getValue().orElse(-1L))
                .containsExactly(tuple("x", -1L), tuple("y", -1L), tuple("all", 0L));
    }

    @Test
    void testSpecialOptionLookup() {
        EnumDef e = EnumDef.builder()
                .flags(true)
                .option(EnumOption.of("a"))
                .option(EnumOption.of("none", SpecialFlag.NO_FLAGS))
                .build();

        assertThat(EnumOptionLayout.noFlagsOption(e)).map(o -> o.getIdent().getName()).contains("none");
        assertThat(EnumOptionLayout.allFlagsOption(e)).isEmpty();
        assertThat(EnumOptionLayout.ordinaryOptions(e)).extracting(o -> o.getIdent().getName()).containsExactly("a");
    }
}
