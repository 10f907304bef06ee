package dev.reviewgate.analysis.dependency;

import java.util.ArrayList;
import java.util.List;

/**
 * "Affected below" constraint: a version is affected when it compares strictly lower than
 * {@code fixedIn}. Versions compare by their numeric dotted segments; a segment's
 * non-numeric suffix is ignored and missing segments count as zero.
 */
public record VersionConstraint(String fixedIn) {

    public static VersionConstraint below(String fixedIn) {
        return new VersionConstraint(fixedIn);
    }

    /** False when {@code version} has no numeric leading segment (e.g. {@code latest}, {@code *}). */
    public boolean isAffected(String version) {
        List<Integer> candidate = segments(version);
        if (candidate.isEmpty()) return false;
        return compare(candidate, segments(fixedIn)) < 0;
    }

    static int compare(List<Integer> a, List<Integer> b) {
        int n = Math.max(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int x = i < a.size() ? a.get(i) : 0;
            int y = i < b.size() ? b.get(i) : 0;
            if (x != y) return Integer.compare(x, y);
        }
        return 0;
    }

    static List<Integer> segments(String version) {
        List<Integer> result = new ArrayList<>();
        if (version == null) return result;
        String v = version.strip();
        if (v.startsWith("v") || v.startsWith("V")) v = v.substring(1);
        for (String part : v.split("\\.")) {
            int end = 0;
            while (end < part.length() && Character.isDigit(part.charAt(end))) end++;
            if (end == 0) break;
            try {
                result.add(Integer.parseInt(part.substring(0, end)));
            } catch (NumberFormatException e) {
                break;
            }
            if (end < part.length()) break;
        }
        return result;
    }

    @Override
    public String toString() {
        return "<" + fixedIn;
    }
}
