package info.isaksson.erland.tonto.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Finds {@code .tonto} files under a root directory.
 *
 * <p>The result is sorted by path relative to the root ('/' separators), so it is the same on
 * every platform and every run.</p>
 */
public final class SourceScanner {

    public static final String EXTENSION = ".tonto";

    private SourceScanner() {}

    /**
     * @param root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to {@code root}; a plain
     *                     directory name excludes everything below it
     */
    public static List<Path> scan(Path root, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(root, "root");

        final List<Predicate<Path>> excludes = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .filter(p -> !isInIgnoredDir(root, p))
                .filter(p -> !matchesAny(root, p, excludes))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> relativeName(root, p)));
            return out;
        }
    }

    /** Path of {@code file} relative to {@code root}, with '/' separators. */
    public static String relativeName(Path root, Path file) {
        return normalize(root.relativize(file));
    }

    private static boolean matchesAny(Path root, Path file, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        Path rel = root.relativize(file);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim().replace("\\", "/");
            if (pattern.isEmpty()) continue;

            // bare directory: exclude its whole subtree
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalize(p))));
        }
        return out;
    }

    private static boolean isInIgnoredDir(Path root, Path file) {
        String rel = relativeName(root, file);
        return rel.startsWith("target/")
                || rel.startsWith("build/")
                || rel.startsWith("out/")
                || rel.startsWith(".git/")
                || rel.startsWith(".idea/")
                || rel.startsWith("node_modules/");
    }

    private static String normalize(Path p) {
        return p.toString().replace("\\", "/");
    }
}
