package dev.reviewgate.review;

import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.valueobject.CommentLocation;
import dev.reviewgate.domain.valueobject.ConsolidatedComment;
import dev.reviewgate.domain.valueobject.RawComment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommentConsolidatorTest {

    private final CommentConsolidator consolidator = new CommentConsolidator();

    @Test
    @DisplayName("comments at the same location merge into one")
    void mergesSameLocation() {
        ConsolidationResult result = consolidator.consolidate(List.of(
                RawComment.at("a.cs", 10, "x", CommentSeverity.INFO),
                RawComment.at("a.cs", 10, "y", CommentSeverity.INFO)));

        List<ConsolidatedComment> comments = result.toLocationComments();
        assertThat(comments).hasSize(1);
        assertThat(comments.get(0).location()).isEqualTo(new CommentLocation("a.cs", 10));
        assertThat(comments.get(0).content()).contains("x").contains("y");
    }

    @Test
    @DisplayName("merged comment carries the highest severity and lists each entry")
    void mergedFormat() {
        ConsolidationResult result = consolidator.consolidate(List.of(
                RawComment.at("a.cs", 3, "naming", CommentSeverity.INFO),
                RawComment.at("a.cs", 3, "null deref", CommentSeverity.ERROR),
                RawComment.at("a.cs", 3, "slow loop", CommentSeverity.WARNING)));

        ConsolidatedComment comment = result.toLocationComments().get(0);
        assertThat(comment.severity()).isEqualTo(CommentSeverity.ERROR);
        assertThat(comment.content()).isEqualTo("""
                **[ERROR]**: Multiple issues found:
                • [INFO] naming
                • [ERROR] null deref
                • [WARNING] slow loop""");
    }

    @Test
    @DisplayName("a single comment renders without a list")
    void singleComment() {
        ConsolidationResult result = consolidator.consolidate(List.of(
                RawComment.at("b.ts", 5, "prefer const", CommentSeverity.WARNING)));

        assertThat(result.toLocationComments()).singleElement()
                .extracting(ConsolidatedComment::content)
                .isEqualTo("**[WARNING]**: prefer const");
    }

    @Test
    @DisplayName("distinct lines and files stay separate, in first-seen order")
    void distinctLocations() {
        ConsolidationResult result = consolidator.consolidate(List.of(
                RawComment.at("b.cs", 1, "b1", CommentSeverity.INFO),
                RawComment.at("a.cs", 1, "a1", CommentSeverity.INFO),
                RawComment.at("a.cs", 2, "a2", CommentSeverity.INFO),
                RawComment.at("b.cs", 1, "b1 again", CommentSeverity.WARNING)));

        assertThat(result.toLocationComments()).extracting(c -> c.location().toString())
                .containsExactly("b.cs:1", "a.cs:1", "a.cs:2");
        assertThat(result.toLocationComments().get(0).severity()).isEqualTo(CommentSeverity.WARNING);
    }

    @Test
    @DisplayName("comments without a usable location are general")
    void generalComments() {
        ConsolidationResult result = consolidator.consolidate(List.of(
                RawComment.general("overall fine", CommentSeverity.INFO),
                new RawComment("a.cs", 0, "line zero", CommentSeverity.INFO, null),
                new RawComment("", 4, "no file", CommentSeverity.INFO, null)));

        assertThat(result.general()).hasSize(3);
        assertThat(result.toLocationComments()).isEmpty();
    }
}
