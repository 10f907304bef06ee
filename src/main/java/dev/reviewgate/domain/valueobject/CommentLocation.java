package dev.reviewgate.domain.valueobject;

/**
 * Exact inline position of a comment thread.
 */
public record CommentLocation(String filePath, int lineNumber) {

    @Override
    public String toString() {
        return filePath + ":" + lineNumber;
    }
}
