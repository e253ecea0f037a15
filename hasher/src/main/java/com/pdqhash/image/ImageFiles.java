package com.pdqhash.image;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Finds image files by extension.
 */
public final class ImageFiles {

    private ImageFiles() {
    }

    public static boolean hasImageExtension(Path file, List<String> extensions) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (String candidate : extensions) {
            if (candidate.toLowerCase(Locale.ROOT).equals(ext)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Expands {@code path}: a regular file is returned as is, a directory is
     * walked recursively for files with one of {@code extensions}. Results
     * are sorted so repeated runs visit files in the same order.
     */
    public static List<Path> find(Path path, List<String> extensions) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(path)) {
            files.add(path);
            return files;
        }

        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && hasImageExtension(file, extensions)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(files);
        return files;
    }
}
