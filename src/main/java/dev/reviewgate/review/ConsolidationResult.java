package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.CommentLocation;
import dev.reviewgate.domain.valueobject.ConsolidatedComment;
import dev.reviewgate.domain.valueobject.RawComment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comments split into general ones (folded into the summary) and per-location groups.
 * {@code byLocation} keeps first-seen order.
 */
public record ConsolidationResult(List<RawComment> general, Map<CommentLocation, List<RawComment>> byLocation) {

    public ConsolidationResult {
        general = List.copyOf(general);
        Map<CommentLocation, List<RawComment>> copy = new LinkedHashMap<>();
        byLocation.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        byLocation = Collections.unmodifiableMap(copy);
    }

    /** One comment per location, ready to post. */
    public List<ConsolidatedComment> toLocationComments() {
        List<ConsolidatedComment> result = new ArrayList<>(byLocation.size());
        byLocation.forEach((location, group) -> result.add(new ConsolidatedComment(
                location, CommentConsolidator.render(group), CommentConsolidator.maxSeverity(group))));
        return result;
    }
}
