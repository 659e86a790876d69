package com.verolang.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for locating and naming Vero source files.
 */
public final class FileUtils {

    /** Extension of Vero source files, without the dot. */
    public static final String VERO_EXTENSION = "vero";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Example patterns: {@code **&#47;*.vero}, {@code pages/*.vero}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against paths relative to {@code rootPath}
     * @return matching paths in sorted order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath) || matcher.matches(relativePath.getFileName());
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Expands command line inputs into Vero source files: files are taken as they are,
     * directories are searched recursively for {@code .vero} files.
     *
     * @param inputs files or directories
     * @return source files in input order
     * @throws IOException if a directory cannot be traversed
     */
    public static List<Path> collectSources(List<Path> inputs) throws IOException {
        List<Path> sources = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                sources.addAll(findFiles(input, "**/*." + VERO_EXTENSION));
            } else {
                sources.add(input);
            }
        }
        return sources;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Replaces the extension of a file name, e.g. {@code login.vero} to {@code login.spec.ts}.
     *
     * @param path source path
     * @param newExtension extension without the leading dot
     * @return file name with the new extension
     */
    public static String withExtension(Path path, String newExtension) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String base = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        return base + "." + newExtension;
    }
}
