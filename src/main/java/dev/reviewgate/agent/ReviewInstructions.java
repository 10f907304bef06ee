package dev.reviewgate.agent;

import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.enums.FileCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Source of the instruction block appended to every review prompt.
 *
 * <p>Full per-category instructions live in {@code classpath:prompts/<category>.txt}. A
 * configured custom prompt file replaces them all.
 */
@Component
public class ReviewInstructions {

    private static final Logger log = LoggerFactory.getLogger(ReviewInstructions.class);

    static final String RESPONSE_FORMAT = """

            ## Response Format

            Format your response as JSON:
            ```json
            {
                "approved": true/false,
                "severity": "approved/minor/major/critical",
                "summary": "Overall assessment of the changes",
                "comments": [
                    {
                        "file_path": "path/to/file",
                        "line_number": 123,
                        "content": "Specific feedback",
                        "severity": "info/warning/error"
                    }
                ],
                "test_suggestions": [
                    {
                        "test_name": "TestClassName.TestMethodName",
                        "description": "What this test should verify",
                        "test_code": "// Arrange\\n// Act\\n// Assert"
                    }
                ]
            }
            ```

            ## Severity Guidelines
            - **approved**: Code meets standards, follows best practices
            - **minor**: Style issues, minor improvements
            - **major**: Performance, maintainability, or design issues
            - **critical**: Security vulnerabilities, bugs, or data integrity issues

            ## Test Suggestions
            For any bug fixes or new features, provide specific test suggestions with:
            - Concrete test method names
            - Description of what each test verifies
            - Stubbed test code in the appropriate testing framework
            - Focus on edge cases, error conditions, and critical paths
            - For bug fixes: MUST include tests that verify the fix
            """;

    static final String FALLBACK_DEFAULT = """
            Review the pull request for code quality, security, performance, and best practices.
            """ + RESPONSE_FORMAT;

    private static final String GENERIC_GUIDELINES = "- Follow language best practices\n- Ensure security and performance\n";

    private static final Map<FileCategory, String> CONDENSED = new EnumMap<>(FileCategory.class);

    static {
        CONDENSED.put(FileCategory.CSHARP, """
                - SOLID principles, dependency injection, async/await patterns
                - Security: input validation, SQL injection prevention
                - Performance: LINQ efficiency, memory management
                - Null safety, error handling, proper disposal
                """);
        CONDENSED.put(FileCategory.RAZOR_VIEW, """
                - XSS prevention: proper encoding, avoid @Html.Raw with user input
                - CSRF protection: @Html.AntiForgeryToken in forms
                - Performance: minimize view logic, avoid database calls
                - Model binding, partial views, JavaScript integration
                """);
        CONDENSED.put(FileCategory.JAVASCRIPT, """
                - Use const/let (never var), strict equality (===)
                - Async patterns: Promises, async/await, error handling
                - DOM efficiency, event delegation, memory leaks
                - Security: XSS prevention, no eval(), input validation
                """);
        CONDENSED.put(FileCategory.TYPESCRIPT, """
                - Type safety: avoid 'any', use unknown when needed
                - Interfaces, generics, discriminated unions
                - Strict mode compliance, null checks
                - Proper import/export patterns
                """);
        CONDENSED.put(FileCategory.JAVA, """
                - Resource handling: try-with-resources, no leaked streams or connections
                - Exceptions: no swallowed exceptions, meaningful types
                - Concurrency: shared mutable state, thread-safe collections
                - Security: parameterized queries, input validation, no secrets in code
                """);
        CONDENSED.put(FileCategory.PYTHON, """
                - PEP 8 style, type hints on public functions
                - Exceptions: no bare except, context managers for resources
                - Security: no eval/exec or shell=True on user input, parameterized queries
                - Mutable default arguments, generator and iterator usage
                """);
        CONDENSED.put(FileCategory.SQL, """
                - SQL injection prevention: parameterized queries
                - Performance: indexes, execution plans, set-based logic
                - Transactions, error handling, constraints
                - Proper NULL handling, data types
                """);
        String testGuidelines = """
                - Test coverage: edge cases, error conditions
                - AAA pattern, single assertion per test
                - Proper mocking, test independence
                - Descriptive test names, fast execution
                """;
        for (FileCategory test : List.of(FileCategory.TEST_CSHARP, FileCategory.TEST_JAVASCRIPT,
                FileCategory.TEST_JAVA, FileCategory.TEST_PYTHON)) {
            CONDENSED.put(test, testGuidelines);
        }
    }

    private final ReviewProperties properties;
    private final Map<String, Optional<String>> resourceCache = new ConcurrentHashMap<>();
    private volatile Optional<String> customTemplate;

    public ReviewInstructions(ReviewProperties properties) {
        this.properties = properties;
    }

    /** The configured custom template, if any and readable. Read once. */
    public Optional<String> customTemplate() {
        Optional<String> cached = customTemplate;
        if (cached != null) return cached;
        String file = properties.customPromptFile();
        Optional<String> loaded = Optional.empty();
        if (file != null && !file.isBlank()) {
            try {
                loaded = Optional.of(Files.readString(Path.of(file), StandardCharsets.UTF_8));
                log.info("Using custom review prompt from {}", file);
            } catch (IOException e) {
                log.warn("Failed to load custom prompt file {}: {}. Using category prompts", file, e.getMessage());
            }
        }
        customTemplate = loaded;
        return loaded;
    }

    /** Full instruction text for one category, falling back to the default text. */
    public String forCategory(FileCategory category) {
        return classpathText("prompts/" + category.id() + ".txt")
                .map(text -> text + RESPONSE_FORMAT)
                .orElseGet(this::defaultText);
    }

    public String defaultText() {
        return classpathText("prompts/default.txt")
                .map(text -> text + RESPONSE_FORMAT)
                .orElse(FALLBACK_DEFAULT);
    }

    /**
     * Combined block for PRs spanning several significant categories: per-category counts,
     * condensed guidance for each significant category present, then the response format.
     */
    public String combined(Map<FileCategory, List<String>> categories) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Multi-Type Code Review\n\n");
        sb.append("This PR contains multiple file types. Review each according to its specific requirements.\n\n");
        sb.append("## Files by Type:\n");
        categories.forEach((category, files) -> {
            if (!files.isEmpty()) sb.append("- **").append(category.id()).append("**: ")
                    .append(files.size()).append(" file(s)\n");
        });
        sb.append("\n## Review Guidelines:\n\n");
        for (FileCategory category : FileCategory.SIGNIFICANT_PRIORITY) {
            List<String> files = categories.get(category);
            if (files == null || files.isEmpty()) continue;
            sb.append("### ").append(category.title()).append(" Files:\n");
            sb.append(condensed(category)).append('\n');
        }
        sb.append(RESPONSE_FORMAT);
        return sb.toString();
    }

    static String condensed(FileCategory category) {
        return CONDENSED.getOrDefault(category, GENERIC_GUIDELINES);
    }

    private Optional<String> classpathText(String location) {
        return resourceCache.computeIfAbsent(location, loc -> {
            Resource resource = new ClassPathResource(loc);
            if (!resource.exists()) return Optional.empty();
            try {
                return Optional.of(resource.getContentAsString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read bundled prompt " + loc, e);
            }
        });
    }
}
