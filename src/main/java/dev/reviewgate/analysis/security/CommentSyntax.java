package dev.reviewgate.analysis.security;

import java.util.List;
import java.util.Locale;

/**
 * Comment prefixes per file family, chosen by extension only.
 */
final class CommentSyntax {

    private static final List<String> C_FAMILY = List.of(".cs", ".java", ".js", ".ts", ".tsx", ".jsx", ".kt", ".go", ".php");
    private static final List<String> HASH_FAMILY = List.of(".py", ".sh", ".bash", ".rb", ".yml", ".yaml", ".properties", ".env");
    private static final List<String> MARKUP_FAMILY = List.of(".html", ".htm", ".xml", ".xaml", ".config");

    private CommentSyntax() {}

    static boolean isComment(String trimmedLine, String path) {
        String lowerPath = path.toLowerCase(Locale.ROOT);
        if (endsWithAny(lowerPath, C_FAMILY))
            return trimmedLine.startsWith("//") || trimmedLine.startsWith("/*") || trimmedLine.startsWith("*");
        if (endsWithAny(lowerPath, HASH_FAMILY))
            return trimmedLine.startsWith("#");
        if (lowerPath.endsWith(".sql"))
            return trimmedLine.startsWith("--") || trimmedLine.startsWith("/*");
        if (endsWithAny(lowerPath, MARKUP_FAMILY))
            return trimmedLine.startsWith("<!--");
        if (lowerPath.endsWith(".css"))
            return trimmedLine.startsWith("/*");
        return false;
    }

    private static boolean endsWithAny(String lowerPath, List<String> extensions) {
        for (String ext : extensions) {
            if (lowerPath.endsWith(ext)) return true;
        }
        return false;
    }
}
