package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.Ecosystem;

/**
 * Reads declared packages from one kind of dependency manifest. Implementations never
 * throw on malformed input; they return {@link ManifestParseResult#failure}.
 */
public interface ManifestParser {

    Ecosystem ecosystem();

    /** @param fileName last path segment, original case */
    boolean supports(String fileName);

    ManifestParseResult parse(String path, String content);

    /**
     * Strips leading range operators and whitespace, then truncates at the first
     * {@code ,} or {@code ||}.
     */
    static String normalizeVersion(String raw) {
        if (raw == null) return "";
        String v = raw.strip();
        int start = 0;
        while (start < v.length() && "^~>=<! \t".indexOf(v.charAt(start)) >= 0) start++;
        v = v.substring(start);
        int comma = v.indexOf(',');
        if (comma >= 0) v = v.substring(0, comma);
        int or = v.indexOf("||");
        if (or >= 0) v = v.substring(0, or);
        return v.strip();
    }
}
