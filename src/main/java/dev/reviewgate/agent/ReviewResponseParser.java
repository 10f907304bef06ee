package dev.reviewgate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.TestSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the agent's raw reply into a {@link ReviewVerdict}. Never throws: missing fields
 * take defaults and anything that is not a JSON object yields
 * {@link ReviewVerdict#unparsable()}.
 */
@Component
public class ReviewResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ReviewResponseParser.class);

    private final ObjectMapper objectMapper;

    public ReviewResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReviewVerdict parse(String raw) {
        if (raw == null || raw.isBlank()) return ReviewVerdict.unparsable();

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(raw));
        } catch (JsonProcessingException e) {
            log.warn("Review response is not valid JSON: {}", e.getOriginalMessage());
            return ReviewVerdict.unparsable();
        }
        if (root == null || !root.isObject()) {
            log.warn("Review response is not a JSON object");
            return ReviewVerdict.unparsable();
        }
        return toVerdict(root);
    }

    public ReviewVerdict toVerdict(JsonNode root) {
        boolean approved = root.path("approved").asBoolean(false);
        String severity = text(root, "severity");
        String summary = text(root, "summary");

        List<RawComment> comments = new ArrayList<>();
        JsonNode commentsNode = root.path("comments");
        if (commentsNode.isArray()) {
            for (JsonNode entry : commentsNode) {
                if (entry.isObject()) comments.add(comment(entry));
            }
        }

        List<TestSuggestion> suggestions = new ArrayList<>();
        collectSuggestions(first(root, "test_suggestions", "testSuggestions"), suggestions);
        collectSuggestions(first(root, "test_suggestions_by_file", "testSuggestionsByFile"), suggestions);

        return new ReviewVerdict(approved,
                severity == null ? ReviewVerdict.MINOR : severity.toLowerCase(Locale.ROOT),
                summary == null ? ReviewVerdict.DEFAULT_SUMMARY : summary,
                comments, suggestions);
    }

    /** Flat array, or an object mapping file path to an array of suggestions. */
    private static void collectSuggestions(JsonNode node, List<TestSuggestion> out) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode entry : node) {
                if (entry.isObject()) out.add(suggestion(entry, null));
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> files = node.fields();
            while (files.hasNext()) {
                Map.Entry<String, JsonNode> file = files.next();
                if (!file.getValue().isArray()) continue;
                for (JsonNode entry : file.getValue()) {
                    if (entry.isObject()) out.add(suggestion(entry, file.getKey()));
                }
            }
        }
    }

    private static RawComment comment(JsonNode entry) {
        String filePath = text(entry, "file_path", "filePath", "file");
        Integer line = lineNumber(first(entry, "line_number", "lineNumber", "line"));
        String content = text(entry, "content", "message");
        String issueType = text(entry, "issue_type", "issueType");
        return new RawComment(filePath, line, content, CommentSeverity.from(text(entry, "severity")), issueType);
    }

    private static TestSuggestion suggestion(JsonNode entry, String owningFile) {
        String filePath = text(entry, "file_path", "filePath", "file");
        if (filePath == null) filePath = owningFile;
        return new TestSuggestion(
                text(entry, "test_name", "testName", "name"),
                text(entry, "description"),
                text(entry, "test_code", "testCode", "code"),
                filePath);
    }

    private static Integer lineNumber(JsonNode node) {
        if (node == null) return null;
        if (node.canConvertToInt()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    private static String text(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null || value.isContainerNode()) return null;
        return value.asText();
    }

    /** Strips markdown fences and any prose around the outermost JSON object. */
    static String extractJson(String raw) {
        String text = raw.strip();
        int fence = text.indexOf("```");
        if (fence >= 0) {
            int bodyStart = text.indexOf('\n', fence);
            int close = bodyStart < 0 ? -1 : text.indexOf("```", bodyStart);
            if (bodyStart >= 0 && close > bodyStart) text = text.substring(bodyStart + 1, close).strip();
        }
        if (!text.startsWith("{") && !text.startsWith("[")) {
            int open = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (open >= 0 && end > open) text = text.substring(open, end + 1);
        }
        return text;
    }
}
