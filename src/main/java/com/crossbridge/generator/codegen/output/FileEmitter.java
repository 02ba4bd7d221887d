package com.crossbridge.generator.codegen.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crossbridge.generator.codegen.GenerateException;
import com.crossbridge.generator.codegen.config.GeneratorSpec;

/**
 * Creates generated files on behalf of a backend.
 *
 * Every created file is claimed in the session's {@link OutputManifest} and registered in its
 * {@link WrittenFileRegistry}; writing the same path twice, or two paths that differ only by
 * case, fails with a {@link GenerateException}. With {@link GeneratorSpec#isSkipGeneration()}
 * set, paths are claimed but nothing touches the file system.
 */
public class FileEmitter {

    private static final Logger log = LoggerFactory.getLogger(FileEmitter.class);

    private final GenerationSession session;
    private final boolean skipGeneration;

    public FileEmitter(GeneratorSpec spec, GenerationSession session) {
        this.session = session;
        this.skipGeneration = spec.isSkipGeneration();
    }

    /**
     * Creates {@code folder/fileName} and fills it through {@code body}.
     *
     * @param makeWriter wraps the raw UTF-8 writer, e.g. to use a different indent
     * @throws GenerateException on a path collision or an I/O failure
     */
    public void createFile(Path folder, String fileName,
                           Function<Writer, IndentWriter> makeWriter,
                           Consumer<IndentWriter> body) {
        Path file = folder.resolve(fileName);
        session.getManifest().claim(file);
        if (skipGeneration) {
            log.debug("Dry run, not writing {}", file);
            return;
        }

        String canonical = canonicalPath(file);
        Optional<String> existing = session.getWrittenFiles().register(canonical);
        if (existing.isPresent()) {
            if (existing.get().equals(canonical)) {
                throw new GenerateException(
                        "Refusing to write \"" + file + "\"; we already wrote a file to that path.");
            }
            throw new GenerateException(
                    "Refusing to write \"" + file + "\"; we already wrote a file to a path that is the same when lower-cased: \""
                            + existing.get() + "\".");
        }

        write(file, makeWriter, body, false);
    }

    public void createFile(Path folder, String fileName, Consumer<IndentWriter> body) {
        createFile(folder, fileName, IndentWriter::new, body);
    }

    /**
     * Like {@link #createFile(Path, String, Consumer)}, but a path already registered in this
     * session is skipped silently. For shared files that several declarations ask for.
     *
     * @return whether {@code body} ran (or would have run, in a dry run)
     */
    public boolean createFileOnce(Path folder, String fileName, Consumer<IndentWriter> body) {
        Path file = folder.resolve(fileName);
        String canonical = canonicalPath(file);
        if (session.getWrittenFiles().register(canonical).isPresent()) {
            log.debug("Already generated {}, skipping", file);
            return false;
        }

        session.getManifest().claim(file);
        if (skipGeneration) {
            log.debug("Dry run, not writing {}", file);
            return true;
        }

        write(file, IndentWriter::new, body, false);
        return true;
    }

    /**
     * Appends to a file created earlier in this session. Neither claimed nor registered.
     */
    public void appendToFile(Path folder, String fileName, Consumer<IndentWriter> body) {
        if (skipGeneration) {
            return;
        }
        write(folder.resolve(fileName), IndentWriter::new, body, true);
    }

    private void write(Path file, Function<Writer, IndentWriter> makeWriter,
                       Consumer<IndentWriter> body, boolean append) {
        StandardOpenOption[] options = append
                ? new StandardOpenOption[] {StandardOpenOption.WRITE, StandardOpenOption.APPEND}
                : new StandardOpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};

        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8, options)) {
            body.accept(makeWriter.apply(out));
            out.flush();
        } catch (IOException e) {
            throw new GenerateException("Unable to write \"" + file + "\": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new GenerateException("Unable to write \"" + file + "\": " + e.getCause().getMessage(), e);
        }
        log.debug("{} {}", append ? "Appended to" : "Wrote", file);
    }

    private static String canonicalPath(Path file) {
        try {
            return file.toFile().getCanonicalPath();
        } catch (IOException e) {
            throw new GenerateException("Unable to resolve canonical path of \"" + file + "\": " + e.getMessage(), e);
        }
    }
}
