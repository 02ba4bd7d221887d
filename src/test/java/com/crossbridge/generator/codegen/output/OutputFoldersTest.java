package com.crossbridge.generator.codegen.output;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.crossbridge.generator.codegen.GenerateException;

class OutputFoldersTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesParents() {
        Path folder = tempDir.resolve("gen/cpp/include");

        OutputFolders.createFolder("C++ header", folder);

        assertThat(folder).isDirectory();
    }

    @Test
    void testExistingFolderIsFine() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("java"));

        OutputFolders.createFolder("Java", folder);

        assertThat(folder).isDirectory();
    }

    @Test
    void testFileInTheWay() throws Exception {
        Path folder = tempDir.resolve("objc");
        Files.writeString(folder, "not a folder");

        assertThatThrownBy(() -> OutputFolders.createFolder("Objective-C", folder))
                .isInstanceOf(GenerateException.class)
                .hasMessage("Unable to create Objective-C folder at \"" + folder + "\", there's something in the way.");
    }

    @Test
    void testFileInTheWayOfParent() throws Exception {
        Path blocker = tempDir.resolve("gen");
        Files.writeString(blocker, "");
        Path folder = blocker.resolve("cpp");

        assertThatThrownBy(() -> OutputFolders.createFolder("C++", folder))
                .isInstanceOf(GenerateException.class)
                .hasMessageStartingWith("Unable to create C++ folder at \"" + folder + "\"");
    }
}
