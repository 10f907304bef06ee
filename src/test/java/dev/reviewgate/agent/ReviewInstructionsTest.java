package dev.reviewgate.agent;

import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.enums.FileCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewInstructionsTest {

    private final ReviewInstructions instructions = new ReviewInstructions(ReviewProperties.defaults());

    @Test
    @DisplayName("category text comes from the bundled prompt plus the response format")
    void categoryText() {
        assertThat(instructions.forCategory(FileCategory.SQL))
                .endsWith(ReviewInstructions.RESPONSE_FORMAT)
                .doesNotContain("Multi-Type");
    }

    @Test
    @DisplayName("categories without a bundled prompt use the default text")
    void missingCategoryPrompt() {
        assertThat(instructions.forCategory(FileCategory.MARKDOWN)).isEqualTo(instructions.defaultText());
    }

    @Test
    @DisplayName("combined block lists significant categories in priority order")
    void combined() {
        Map<FileCategory, List<String>> categories = new LinkedHashMap<>();
        categories.put(FileCategory.SQL, List.of("a.sql"));
        categories.put(FileCategory.MARKDOWN, List.of("README.md"));
        categories.put(FileCategory.CSHARP, List.of("a.cs", "b.cs"));

        String combined = instructions.combined(categories);

        assertThat(combined).contains("- **csharp**: 2 file(s)", "- **markdown**: 1 file(s)")
                .doesNotContain("### Markdown Files:");
        assertThat(combined.indexOf("### Csharp Files:")).isLessThan(combined.indexOf("### Sql Files:"));
    }

    @Test
    @DisplayName("a readable custom prompt file replaces category prompts")
    void customTemplate(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("team-prompt.md");
        Files.writeString(file, "Team rules only.");
        ReviewInstructions custom = new ReviewInstructions(
                new ReviewProperties(file.toString(), null, null, 0));

        assertThat(custom.customTemplate()).contains("Team rules only.");
    }

    @Test
    @DisplayName("an unreadable custom prompt file is ignored")
    void unreadableCustomTemplate(@TempDir Path dir) {
        ReviewInstructions custom = new ReviewInstructions(
                new ReviewProperties(dir.resolve("missing.md").toString(), null, null, 0));

        assertThat(custom.customTemplate()).isEmpty();
        assertThat(instructions.customTemplate()).isEmpty();
    }
}
