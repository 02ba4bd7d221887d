package com.crossbridge.generator.codegen.render;

import static org.assertj.core.api.Assertions.*;

import java.io.StringWriter;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.crossbridge.generator.codegen.config.CppSpec;
import com.crossbridge.generator.codegen.config.GeneratorSpec;
import com.crossbridge.generator.codegen.ident.IdentStyle;
import com.crossbridge.generator.codegen.output.IndentWriter;
import com.crossbridge.generator.model.Doc;
import com.crossbridge.generator.model.EnumDef;
import com.crossbridge.generator.model.EnumOption;
import com.crossbridge.generator.model.Field;
import com.crossbridge.generator.model.Ident;
import com.crossbridge.generator.model.Method;
import com.crossbridge.generator.model.SpecialFlag;

class CodeRendererTest {

    private final StringWriter out = new StringWriter();
    private final IndentWriter w = new IndentWriter(out);
    private final CodeRenderer renderer = new CodeRenderer(GeneratorSpec.builder().build());

    @Test
    void testWrapNestedNamespace() {
        renderer.wrapNamespace(w, "a::b::c", inner -> inner.wl("BODY"));

        assertThat(out.toString()).isEqualTo("""
                namespace a { namespace b { namespace c {

                BODY

                } } }  // namespace a::b::c
                """);
    }

    @Test
    void testWrapSingleNamespace() {
        renderer.wrapNamespace(w, "djinni", inner -> inner.wl("int x;"));

        assertThat(out.toString()).isEqualTo("namespace djinni {\n\nint x;\n\n}  // namespace djinni\n");
    }

    @Test
    void testEmptyNamespaceLeavesBodyUnwrapped() {
        renderer.wrapNamespace(w, "", inner -> inner.wl("int x;"));

        assertThat(out.toString()).isEqualTo("int x;\n");
    }

    @Test
    void testWrapAnonymousNamespace() {
        renderer.wrapAnonymousNamespace(w, inner -> inner.wl("static int x;"));

        assertThat(out.toString()).isEqualTo("""
                namespace { // anonymous namespace

                static int x;

                } // end anonymous namespace
                """);
    }

    @Test
    void testWithNs() {
        assertThat(renderer.withNs(Optional.empty(), "Foo")).isEqualTo("Foo");
        assertThat(renderer.withNs(Optional.of(""), "Foo")).isEqualTo("::Foo");
        assertThat(renderer.withNs(Optional.of("a::b"), "Foo")).isEqualTo("::a::b::Foo");
    }

    @Test
    void testWithCppNs() {
        CodeRenderer scoped = new CodeRenderer(GeneratorSpec.builder()
                .cpp(CppSpec.builder().namespace("textsort").build())
                .build());

        assertThat(scoped.withCppNs("ItemList")).isEqualTo("::textsort::ItemList");
        assertThat(renderer.withCppNs("ItemList")).isEqualTo("::ItemList");
    }

    @Test
    void testWriteAlignedCall() {
        renderer.writeAlignedCall(w, "Foo(", List.of("a", "b", "c"), ")", s -> s);

        assertThat(out.toString()).isEqualTo("Foo(a,\n    b,\n    c)");
    }

    @Test
    void testWriteAlignedCallWithDelimiterInsideIndent() {
        w.nested(() -> renderer.writeAlignedCall(w, "f(", List.of(1, 2), " +", ");", i -> "x" + i).wl());

        assertThat(out.toString()).isEqualTo("    f(x1 +\n      x2);\n");
    }

    @Test
    void testWriteAlignedCallWithoutParams() {
        renderer.writeAlignedCall(w, "Foo(", List.<String>of(), ")", s -> s);

        assertThat(out.toString()).isEqualTo("Foo()");
    }

    @Test
    void testWriteAlignedObjcCall() {
        renderer.writeAlignedObjcCall(w, "[obj setWidth", List.of("w", "h"), "]",
                v -> new KeywordArg(v.equals("w") ? "setWidth" : "height", v));

        assertThat(out.toString()).isEqualTo("[obj setWidth:w\n       height:h]");
    }

    @Test
    void testWriteAlignedObjcCallWithLongKeyword() {
        renderer.writeAlignedObjcCall(w, "[a b", List.of("x", "y"), "]",
                v -> new KeywordArg(v.equals("x") ? "b" : "veryLongKeyword", v));

        assertThat(out.toString()).isEqualTo("[a b:x\nveryLongKeyword:y]");
    }

    @Test
    void testFlagsEnumInEmissionOrder() {
        EnumDef e = EnumDef.builder()
                .flags(true)
                .option(EnumOption.of("d", SpecialFlag.NO_FLAGS))
                .option(EnumOption.of("a"))
                .option(EnumOption.of("e", SpecialFlag.ALL_FLAGS))
                .option(EnumOption.of("b"))
                .option(EnumOption.of("c"))
                .build();

        renderer.writeEnumOptionsInOrder(w, e, IdentStyle.UNDER_CAPS);

        assertThat(out.toString()).isEqualTo("""
                D = 0,
                A = 1 << 0,
                B = 1 << 1,
                C = 1 << 2,
                E = 0 | A | B | C,
                """);
    }

    @Test
    void testAllFlagsWithoutOrdinaryOptions() {
        EnumDef e = EnumDef.builder()
                .flags(true)
                .option(EnumOption.of("all", SpecialFlag.ALL_FLAGS))
                .build();

        renderer.writeEnumOptionAll(w, e, IdentStyle.CAMEL_UPPER);

        assertThat(out.toString()).isEqualTo("All = 0,\n");
    }

    @Test
    void testAllFlagsInPlainEnumMatchesLayout() {
        EnumDef e = EnumDef.builder()
                .option(EnumOption.of("red"))
                .option(EnumOption.of("green"))
                .option(EnumOption.of("every_color", SpecialFlag.ALL_FLAGS))
                .build();

        renderer.writeEnumOptionsInOrder(w, e, IdentStyle.CAMEL_UPPER);

        assertThat(out.toString()).isEqualTo("Red,\nGreen,\nEveryColor = 0,\n");
        EnumOptionEntry all = EnumOptionLayout.of(e).get(2);
        assertThat(all.getName()).isEqualTo("every_color");
        assertThat(all.getValue()).hasValue(0L);
    }

    @Test
    void testPlainEnumHasNoValues() {
        EnumDef e = EnumDef.builder()
                .option(EnumOption.builder().ident(Ident.of("red")).doc(Doc.of(" warm")).build())
                .option(EnumOption.of("light_blue"))
                .build();

        renderer.writeEnumOptionsInOrder(w, e, IdentStyle.CAMEL_UPPER);

        assertThat(out.toString()).isEqualTo("/** warm */\nRed,\nLightBlue,\n");
    }

    @Test
    void testWriteDoc() {
        renderer.writeDoc(w, Doc.EMPTY);
        renderer.writeDoc(w, Doc.of(" One line"));
        renderer.writeDoc(w, Doc.of(" First", "", "  indented"));

        assertThat(out.toString()).isEqualTo("""
                /** One line */
                /**
                 * First
                 *
                 *  indented
                 */
                """);
    }

    @Test
    void testWriteMethodDocRenamesWholeWordParams() {
        Method method = Method.builder()
                .ident(Ident.of("find_item"))
                .param(Field.of("item_id", "i64"))
                .param(Field.of("max_count", "i32"))
                .doc(Doc.of(" Looks up item_id, not item_ids; at most max_count of them."))
                .build();

        renderer.writeMethodDoc(w, method, IdentStyle.CAMEL_LOWER);

        assertThat(out.toString()).isEqualTo("/** Looks up itemId, not item_ids; at most maxCount of them. */\n");
    }

    @Test
    void testRenameParamsQuotesReplacement() {
        Doc renamed = renderer.renameParams(Doc.of(" uses x"), List.of(Field.of("x", "i32")), token -> "$" + token);

        assertThat(renamed.getLines()).containsExactly(" uses $x");
    }
}
