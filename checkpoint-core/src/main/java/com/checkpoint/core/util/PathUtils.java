package com.checkpoint.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.stream.Stream;

/**
 * Utility class for recursive filesystem operations.
 */
public final class PathUtils {

    private PathUtils() {
        // Utility class
    }

    /**
     * Reads a file as UTF-8 text. Malformed byte sequences are replaced with
     * U+FFFD instead of failing the read.
     *
     * @param path file to read
     * @return file content
     * @throws IOException if the file cannot be read
     */
    public static String readString(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Deletes a file or directory tree. A missing path is not an error.
     *
     * @param path file or directory to delete
     * @throws IOException if an existing entry cannot be removed
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Computes the total size of the regular files below a path.
     *
     * @param path file or directory
     * @return size in bytes
     * @throws IOException if the tree cannot be walked
     */
    public static long sizeOf(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            return Files.size(path);
        }
        try (Stream<Path> paths = Files.walk(path)) {
            long total = 0;
            for (Path entry : (Iterable<Path>) paths::iterator) {
                if (Files.isRegularFile(entry)) {
                    total += Files.size(entry);
                }
            }
            return total;
        }
    }

    /**
     * Copies a file or directory tree, replacing existing files at the target.
     *
     * @param source file or directory to copy
     * @param target destination path
     * @throws IOException if any entry cannot be copied
     */
    public static void copyRecursively(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return;
        }
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                    StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
