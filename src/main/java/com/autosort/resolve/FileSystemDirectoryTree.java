package com.autosort.resolve;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

public class FileSystemDirectoryTree implements DirectoryTree {

    @Override
    public List<String> listSubdirectories(Path dir) throws IOException {
        return list(dir, Files::isDirectory);
    }

    @Override
    public List<String> listFiles(Path dir) throws IOException {
        return list(dir, Files::isRegularFile);
    }

    private List<String> list(Path dir, Predicate<Path> filter) throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.filter(filter)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.startsWith("."))
                .forEach(names::add);
        }
        names.sort(String.CASE_INSENSITIVE_ORDER);
        return names;
    }
}
