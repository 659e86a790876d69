package com.verolang.cli;

import com.verolang.core.VeroCompiler;
import com.verolang.core.ast.Program;
import com.verolang.core.config.VeroConfig;
import com.verolang.core.parser.ParseResult;
import com.verolang.core.util.FileUtils;
import com.verolang.core.validator.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads and parses the Vero sources of a project and builds per-file validation contexts.
 */
public final class ProjectSources {

    private static final Logger log = LoggerFactory.getLogger(ProjectSources.class);

    private final Path root;
    private final List<SourceUnit> units;

    private ProjectSources(Path root, List<SourceUnit> units) {
        this.root = root;
        this.units = List.copyOf(units);
    }

    /**
     * Loads every source below the configured directories of {@code projectDir}, or the single
     * file when {@code projectDir} is a file.
     *
     * @param projectDir project root or a single source file
     * @param config project configuration
     * @return parsed sources in path order
     * @throws IllegalStateException if a file cannot be read
     */
    public static ProjectSources load(Path projectDir, VeroConfig config) {
        Path input = projectDir.toAbsolutePath().normalize();
        if (Files.isRegularFile(input)) {
            Path parent = input.getParent();
            return new ProjectSources(parent, List.of(read(parent, input)));
        }

        Set<Path> files = new LinkedHashSet<>();
        try {
            for (String directory : config.sources().directories()) {
                Path dir = input.resolve(directory).normalize();
                if (Files.isDirectory(dir)) {
                    files.addAll(FileUtils.findFiles(dir, config.sources().glob()));
                } else {
                    log.debug("Source directory does not exist: {}", dir);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list sources under " + input, e);
        }

        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            units.add(read(input, file));
        }
        log.debug("Loaded {} source files from {}", units.size(), input);
        return new ProjectSources(input, units);
    }

    private static SourceUnit read(Path root, Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + file, e);
        }
        ParseResult parsed = VeroCompiler.parse(source);
        String relative = root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
        return new SourceUnit(file.toAbsolutePath().normalize(), relative, source, parsed.program(), parsed.errors());
    }

    public Path root() {
        return root;
    }

    public List<SourceUnit> units() {
        return units;
    }

    /**
     * Declarations of every other file that parsed cleanly. The file itself is excluded so its
     * own pages are not reported as duplicates of themselves.
     */
    public ValidationContext contextFor(SourceUnit unit) {
        List<Program> siblings = new ArrayList<>();
        for (SourceUnit other : units) {
            if (!other.path().equals(unit.path()) && !other.hasSyntaxErrors()) {
                siblings.add(other.program());
            }
        }
        return ValidationContext.of(siblings);
    }
}
