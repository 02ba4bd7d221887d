package com.crossbridge.generator.codegen.output;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.crossbridge.generator.codegen.GenerateException;

import lombok.experimental.UtilityClass;

/**
 * Creation of backend output folders.
 */
@UtilityClass
public class OutputFolders {

    /**
     * Creates {@code folder} and its parents.
     *
     * @param label human-readable folder role used in error messages, e.g. "C++ header"
     * @throws GenerateException if the path is occupied by a non-directory or cannot be created
     */
    public static void createFolder(String label, Path folder) {
        try {
            Files.createDirectories(folder);
        } catch (FileAlreadyExistsException e) {
            throw somethingInTheWay(label, folder);
        } catch (IOException e) {
            throw new GenerateException("Unable to create " + label + " folder at \"" + folder + "\".", e);
        }
        if (!Files.isDirectory(folder)) {
            throw somethingInTheWay(label, folder);
        }
    }

    private static GenerateException somethingInTheWay(String label, Path folder) {
        return new GenerateException(
                "Unable to create " + label + " folder at \"" + folder + "\", there's something in the way.");
    }
}
