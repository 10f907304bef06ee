package dev.reviewgate.analysis.security;

import java.util.List;
import java.util.Locale;

/**
 * One non-blank, non-comment line under inspection, with enough surrounding context for
 * detectors that look a few lines ahead.
 *
 * @param index zero-based position of {@code line} within {@code lines}
 */
public record LineContext(String path, String line, List<String> lines, int index) {

    public String lower() {
        return line.toLowerCase(Locale.ROOT);
    }

    public String trimmed() {
        return line.strip();
    }

    public String lowerPath() {
        return path.toLowerCase(Locale.ROOT);
    }

    public boolean pathEndsWith(String... extensions) {
        String lowerPath = lowerPath();
        for (String ext : extensions) {
            if (lowerPath.endsWith(ext)) return true;
        }
        return false;
    }

    /** The {@code count} lines following this one, fewer near the end of the file. */
    public List<String> following(int count) {
        int from = Math.min(index + 1, lines.size());
        int to = Math.min(lines.size(), index + 1 + count);
        return lines.subList(from, to);
    }
}
