package com.crossbridge.generator.codegen.output;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import org.junit.jupiter.api.Test;

class IndentWriterTest {

    private final StringWriter out = new StringWriter();
    private final IndentWriter w = new IndentWriter(out);

    @Test
    void testIndentAppliedAtLineStartOnly() {
        w.wl("class Foo");
        w.braced(() -> {
            w.w("int ").w("x").wl(";");
            w.wl();
            w.wl("int y;");
        });

        assertThat(out.toString()).isEqualTo("""
                class Foo
                {
                    int x;

                    int y;
                }
                """);
    }

    @Test
    void testNestedRestoresIndentAfterException() {
        assertThatThrownBy(() -> w.nested(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        w.wl("top");

        assertThat(out.toString()).isEqualTo("top\n");
    }

    @Test
    void testNestedN() {
        w.nestedN(2, () -> w.wl("deep"));
        w.wl("flat");

        assertThat(out.toString()).isEqualTo("        deep\nflat\n");
    }

    @Test
    void testOutdent() {
        w.nested(() -> {
            w.wlOutdent("public:");
            w.wl("void f();");
        });
        w.wlOutdent("at root");

        assertThat(out.toString()).isEqualTo("public:\n    void f();\nat root\n");
    }

    @Test
    void testCustomIndent() {
        IndentWriter tabs = new IndentWriter(out, "\t");
        tabs.nested(() -> tabs.wl("x"));

        assertThat(out.toString()).isEqualTo("\tx\n");
    }

    @Test
    void testEmptyWriteDoesNotIndent() {
        w.nested(() -> w.w("").wl());

        assertThat(out.toString()).isEqualTo("\n");
    }

    @Test
    void testIoFailureIsUnchecked() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };
        IndentWriter failing = new IndentWriter(broken);

        assertThatThrownBy(() -> failing.wl("x"))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk full");
        assertThatThrownBy(failing::flush).isInstanceOf(UncheckedIOException.class);
    }
}
