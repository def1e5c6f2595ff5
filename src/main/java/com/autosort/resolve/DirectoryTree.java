package com.autosort.resolve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Read-only view of the directory tree being organized.
 */
public interface DirectoryTree {

    /**
     * Names of the immediate subdirectories of {@code dir}, sorted case-insensitively.
     */
    List<String> listSubdirectories(Path dir) throws IOException;

    /**
     * Names of the regular files directly inside {@code dir}.
     */
    List<String> listFiles(Path dir) throws IOException;
}
