package com.crossbridge.generator.codegen.output;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.crossbridge.generator.codegen.GenerateException;

/**
 * Ordered list of the files a session claims to produce. Claims are recorded whether or not
 * anything is written, so a dry run yields the same list as a real run.
 */
public class OutputManifest {

    private final List<String> paths = new ArrayList<>();
    private final Writer sink;

    public OutputManifest() {
        this(null);
    }

    /**
     * @param sink receives each claimed path followed by a newline; may be {@code null}
     */
    public OutputManifest(Writer sink) {
        this.sink = sink;
    }

    public boolean isRecording() {
        return sink != null;
    }

    public void claim(Path path) {
        String normalized = separatorsToUnix(path.toString());
        paths.add(normalized);
        if (sink == null) {
            return;
        }
        try {
            sink.write(normalized);
            sink.write("\n");
        } catch (IOException e) {
            throw new GenerateException("Unable to write output file list entry \"" + normalized + "\": " + e.getMessage(), e);
        }
    }

    public void flush() {
        if (sink == null) {
            return;
        }
        try {
            sink.flush();
        } catch (IOException e) {
            throw new GenerateException("Unable to flush output file list: " + e.getMessage(), e);
        }
    }

    public List<String> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    static String separatorsToUnix(String path) {
        return path.replace('\\', '/');
    }
}
