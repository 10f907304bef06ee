package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.CommentSeverity;

/**
 * A comment ready for publication. A null location marks a general comment.
 */
public record ConsolidatedComment(CommentLocation location, String content, CommentSeverity severity) {

    public boolean isGeneral() {
        return location == null;
    }
}
