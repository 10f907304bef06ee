package dev.reviewgate.review;

import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.valueobject.CommentLocation;
import dev.reviewgate.domain.valueobject.RawComment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Guarantees at most one comment thread per exact (path, line). Comments sharing a
 * location are merged into one message whose severity is the highest in the group.
 */
@Component
public class CommentConsolidator {

    public ConsolidationResult consolidate(List<RawComment> rawComments) {
        List<RawComment> general = new ArrayList<>();
        Map<CommentLocation, List<RawComment>> byLocation = new LinkedHashMap<>();
        for (RawComment comment : rawComments) {
            if (comment.isGeneral()) {
                general.add(comment);
                continue;
            }
            CommentLocation location = new CommentLocation(comment.filePath(), comment.lineNumber());
            byLocation.computeIfAbsent(location, k -> new ArrayList<>()).add(comment);
        }
        return new ConsolidationResult(general, byLocation);
    }

    /** {@code **[SEV]**: content} for one comment, a bulleted list for several. */
    static String render(List<RawComment> group) {
        if (group.size() == 1) return format(group.get(0));
        StringBuilder sb = new StringBuilder()
                .append("**[").append(tag(maxSeverity(group))).append("]**: Multiple issues found:");
        for (RawComment comment : group) {
            sb.append("\n• [").append(tag(comment.severity())).append("] ").append(comment.content());
        }
        return sb.toString();
    }

    static String format(RawComment comment) {
        return "**[" + tag(comment.severity()) + "]**: " + comment.content();
    }

    static CommentSeverity maxSeverity(List<RawComment> group) {
        CommentSeverity max = CommentSeverity.INFO;
        for (RawComment comment : group) {
            max = CommentSeverity.max(max, comment.severity());
        }
        return max;
    }

    private static String tag(CommentSeverity severity) {
        return severity.name().toUpperCase(Locale.ROOT);
    }
}
