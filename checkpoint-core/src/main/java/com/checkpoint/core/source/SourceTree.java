package com.checkpoint.core.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Locates source packages and files inside a project tree.
 */
public final class SourceTree {

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "build", "out", "node_modules");

    private SourceTree() {
        // Utility class
    }

    /**
     * Finds the first directory (in path order) named {@code packageName} that directly
     * contains at least one non-test {@code .java} file. Hidden and build output
     * directories are skipped.
     *
     * @param root project root
     * @param packageName last segment of the package (e.g., "config")
     * @return package directory, empty if none exists
     * @throws IOException if the tree cannot be walked
     */
    public static Optional<Path> findPackageDirectory(Path root, String packageName) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString());
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isDirectory)
                .filter(dir -> !isSkipped(root, dir))
                .filter(dir -> dir.getFileName() != null && dir.getFileName().toString().equals(packageName))
                .filter(SourceTree::containsSources)
                .sorted(Comparator.comparing(Path::toString))
                .findFirst();
        }
    }

    /**
     * Lists the non-test {@code .java} files directly inside a package directory.
     *
     * @param packageDir package directory
     * @return source files sorted by name
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listSourceFiles(Path packageDir) throws IOException {
        try (Stream<Path> listing = Files.list(packageDir)) {
            return listing
                .filter(Files::isRegularFile)
                .filter(SourceTree::isMainSource)
                .sorted()
                .toList();
        }
    }

    private static boolean containsSources(Path dir) {
        try {
            return !listSourceFiles(dir).isEmpty();
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean isMainSource(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".java")
            && !name.endsWith("Test.java")
            && !name.endsWith("Tests.java")
            && !name.equals("package-info.java");
    }

    private static boolean isSkipped(Path root, Path dir) {
        for (Path segment : root.relativize(dir)) {
            String name = segment.toString();
            if (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name) || "test".equals(name)) {
                return true;
            }
        }
        return false;
    }
}
