package io.github.jbellis.ticketsync;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.errors.InvalidPatternException;
import org.eclipse.jgit.fnmatch.FileNameMatcher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered glob patterns deciding which files are left out of a transfer. A path is ignored if any
 * pattern matches it. Patterns use fnmatch semantics, so {@code *} also crosses '/'.
 */
public final class IgnoreGlobSet {
    private static final Logger logger = LogManager.getLogger(IgnoreGlobSet.class);

    private final List<String> patterns;
    private final List<FileNameMatcher> matchers;

    public IgnoreGlobSet(List<String> patterns) {
        var kept = new ArrayList<String>();
        var compiled = new ArrayList<FileNameMatcher>();
        for (var pattern : patterns) {
            try {
                compiled.add(new FileNameMatcher(pattern, null));
                kept.add(pattern);
            } catch (InvalidPatternException e) {
                logger.warn("Skipping invalid ignore pattern '{}': {}", pattern, e.getMessage());
            }
        }
        this.patterns = ImmutableList.copyOf(kept);
        this.matchers = ImmutableList.copyOf(compiled);
    }

    /**
     * Builds the set from the built-in patterns, then {@code folder/fileName}, then {@code userHome/fileName}.
     * Either file may be absent.
     */
    public static IgnoreGlobSet load(List<String> builtIns, Path folder, Path userHome, String fileName)
            throws IOException {
        var all = new ArrayList<>(builtIns);
        all.addAll(readPatterns(folder.resolve(fileName)));
        all.addAll(readPatterns(userHome.resolve(fileName)));
        return new IgnoreGlobSet(all);
    }

    /**
     * Non-blank, non-comment lines of an ignore file, trimmed.
     */
    static List<String> readPatterns(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
    }

    public boolean matches(String relativePath) {
        for (var compiled : matchers) {
            var matcher = new FileNameMatcher(compiled);
            matcher.append(relativePath);
            if (matcher.isMatch()) {
                return true;
            }
        }
        return false;
    }

    public List<String> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "IgnoreGlobSet" + patterns;
    }
}
