package com.crossbridge.generator.codegen.output;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.crossbridge.generator.codegen.GenerateException;

class OutputManifestTest {

    @Test
    void testClaimsAreListedInOrder() {
        StringWriter sink = new StringWriter();
        OutputManifest manifest = new OutputManifest(sink);

        manifest.claim(Path.of("out", "b.hpp"));
        manifest.claim(Path.of("out", "a.hpp"));
        manifest.flush();

        assertThat(manifest.isRecording()).isTrue();
        assertThat(manifest.getPaths()).containsExactly("out/b.hpp", "out/a.hpp");
        assertThat(sink.toString()).isEqualTo("out/b.hpp\nout/a.hpp\n");
    }

    @Test
    void testBackslashesBecomeForwardSlashes() {
        assertThat(OutputManifest.separatorsToUnix("gen\\cpp\\foo.hpp")).isEqualTo("gen/cpp/foo.hpp");
    }

    @Test
    void testWithoutSinkStillTracksPaths() {
        OutputManifest manifest = new OutputManifest();

        manifest.claim(Path.of("x.h"));
        manifest.flush();

        assertThat(manifest.isRecording()).isFalse();
        assertThat(manifest.getPaths()).containsExactly("x.h");
    }

    @Test
    void testSinkFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        OutputManifest manifest = new OutputManifest(broken);

        assertThatThrownBy(() -> manifest.claim(Path.of("x.h")))
                .isInstanceOf(GenerateException.class)
                .hasMessageContaining("x.h")
                .hasMessageContaining("closed");
    }
}
