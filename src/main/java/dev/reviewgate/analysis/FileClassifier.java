package dev.reviewgate.analysis;

import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns exactly one {@link FileCategory} to every changed file.
 *
 * <p>Rules in priority order: manifest file names, .NET project extensions, test path
 * patterns, extension table, content refinement, then {@link FileCategory#DEFAULT}.
 */
@Component
public class FileClassifier {

    private static final Map<String, FileCategory> MANIFEST_FILES = new LinkedHashMap<>();
    private static final Map<String, FileCategory> EXTENSIONS = Map.ofEntries(
            Map.entry(".cs", FileCategory.CSHARP),
            Map.entry(".cshtml", FileCategory.RAZOR_VIEW),
            Map.entry(".razor", FileCategory.RAZOR_VIEW),
            Map.entry(".js", FileCategory.JAVASCRIPT),
            Map.entry(".jsx", FileCategory.JAVASCRIPT),
            Map.entry(".ts", FileCategory.TYPESCRIPT),
            Map.entry(".tsx", FileCategory.TYPESCRIPT),
            Map.entry(".sql", FileCategory.SQL),
            Map.entry(".md", FileCategory.MARKDOWN),
            Map.entry(".markdown", FileCategory.MARKDOWN),
            Map.entry(".json", FileCategory.JSON),
            Map.entry(".xml", FileCategory.XML),
            Map.entry(".config", FileCategory.CONFIG),
            Map.entry(".css", FileCategory.CSS),
            Map.entry(".scss", FileCategory.CSS),
            Map.entry(".less", FileCategory.CSS),
            Map.entry(".html", FileCategory.HTML),
            Map.entry(".htm", FileCategory.HTML),
            Map.entry(".py", FileCategory.PYTHON),
            Map.entry(".yml", FileCategory.YAML),
            Map.entry(".yaml", FileCategory.YAML),
            Map.entry(".java", FileCategory.JAVA),
            Map.entry(".gradle", FileCategory.PACKAGE_JAVA),
            Map.entry(".kts", FileCategory.PACKAGE_JAVA));

    private static final List<Pattern> TEST_PATTERNS = compile(
            // C#
            ".*\\.Tests?\\.cs$", ".*Test\\.cs$", ".*Tests\\.cs$", ".*Spec\\.cs$",
            ".*\\.Test\\.", ".*\\.Tests\\.", ".*\\.IntegrationTests?\\.", ".*\\.UnitTests?\\.",
            // JavaScript / TypeScript
            ".*\\.test\\.(js|ts|jsx|tsx)$", ".*\\.spec\\.(js|ts|jsx|tsx)$",
            "__tests__/.*\\.(js|ts|jsx|tsx)$", ".*\\.e2e\\.(js|ts)$",
            // Python
            "(^|/)test_[^/]*\\.py$", ".*_test\\.py$",
            // Java
            ".*Tests?\\.java$", ".*IT\\.java$", "(^|/)src/test/java/.*\\.java$");

    private static final Pattern SCRIPT_BLOCK =
            Pattern.compile("<script[^>]*>.*?</script>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    static {
        for (String name : List.of("package.json", "package-lock.json", "yarn.lock",
                "pnpm-lock.yaml", "npm-shrinkwrap.json"))
            MANIFEST_FILES.put(name, FileCategory.PACKAGE_JAVASCRIPT);
        for (String name : List.of("packages.config", "Directory.Packages.props",
                "Directory.Build.props", "paket.dependencies", "paket.lock"))
            MANIFEST_FILES.put(name, FileCategory.PACKAGE_CSHARP);
        for (String name : List.of("requirements.txt", "requirements-dev.txt", "requirements-test.txt",
                "setup.py", "setup.cfg", "pyproject.toml", "Pipfile", "Pipfile.lock", "poetry.lock",
                "environment.yml", "environment.yaml", "conda.yaml"))
            MANIFEST_FILES.put(name, FileCategory.PACKAGE_PYTHON);
        for (String name : List.of("pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle",
                "settings.gradle.kts", "gradle.properties", "ivy.xml", "build.xml"))
            MANIFEST_FILES.put(name, FileCategory.PACKAGE_JAVA);
    }

    public FileCategory classify(String path) {
        return classify(path, null);
    }

    public FileCategory classify(String path, String content) {
        if (path == null || path.isBlank()) return FileCategory.DEFAULT;

        String normalized = path.replace('\\', '/');
        String fileName = fileName(normalized);
        String lowerName = fileName.toLowerCase(Locale.ROOT);

        FileCategory manifest = manifestCategory(fileName);
        if (manifest != null) return manifest;

        if (lowerName.endsWith(".csproj") || lowerName.endsWith(".vbproj") || lowerName.endsWith(".fsproj"))
            return FileCategory.PACKAGE_CSHARP;

        String ext = extension(lowerName);
        FileCategory byExtension = EXTENSIONS.get(ext);

        if (byExtension != null && isTestPath(normalized)) {
            FileCategory test = byExtension.testVariant();
            if (test != byExtension) return test;
        }

        if (byExtension != null) {
            // Razor views keep their category whether or not they carry script; the
            // prompt assembler notes the script separately.
            if (byExtension == FileCategory.JSON && content != null && content.contains("\"dependencies\""))
                return FileCategory.PACKAGE_JAVASCRIPT;
            return byExtension;
        }

        if (List.of("dockerfile", "containerfile", "makefile", "rakefile").contains(lowerName))
            return FileCategory.CONFIG;
        if (lowerName.startsWith(".") && ext.isEmpty())
            return FileCategory.CONFIG;

        return FileCategory.DEFAULT;
    }

    /** True when the path matches any of the known test naming conventions. */
    public boolean isTestPath(String path) {
        if (path == null) return false;
        String normalized = path.replace('\\', '/');
        for (Pattern pattern : TEST_PATTERNS) {
            if (pattern.matcher(normalized).find()) return true;
        }
        return false;
    }

    /**
     * True when markup carries enough script to deserve script-specific review: script blocks
     * over 500 characters or over 20% of the file, or a Razor scripts section.
     */
    public boolean hasSignificantScript(String content) {
        if (content == null || content.isEmpty()) return false;
        Matcher matcher = SCRIPT_BLOCK.matcher(content);
        int total = 0;
        boolean found = false;
        while (matcher.find()) {
            found = true;
            total += matcher.group().length();
        }
        if (found) return total > 500 || total > content.length() * 0.2;
        return content.contains("@section Scripts") || content.contains("@section scripts");
    }

    /** Groups change paths by category, preserving first-seen order. */
    public Map<FileCategory, List<String>> analyzeSet(List<Change> changes) {
        Map<FileCategory, List<String>> groups = new LinkedHashMap<>();
        for (Change change : changes) {
            FileCategory category = classify(change.path(), change.effectiveContent());
            groups.computeIfAbsent(category, k -> new ArrayList<>()).add(change.path());
        }
        return groups;
    }

    public FileCategory dominant(List<Change> changes) {
        return dominant(analyzeSet(changes));
    }

    public FileCategory dominant(Map<FileCategory, List<String>> groups) {
        if (groups.isEmpty()) return FileCategory.DEFAULT;
        for (FileCategory category : FileCategory.SIGNIFICANT_PRIORITY) {
            List<String> paths = groups.get(category);
            if (paths != null && !paths.isEmpty()) return category;
        }
        return groups.entrySet().stream()
                .max(Comparator.comparingInt(e -> e.getValue().size()))
                .map(Map.Entry::getKey)
                .orElse(FileCategory.DEFAULT);
    }

    public boolean needsMixedReview(List<Change> changes) {
        return needsMixedReview(analyzeSet(changes));
    }

    public boolean needsMixedReview(Map<FileCategory, List<String>> groups) {
        long significant = groups.entrySet().stream()
                .filter(e -> e.getKey().isSignificant() && !e.getValue().isEmpty())
                .count();
        return significant > 1;
    }

    private static FileCategory manifestCategory(String fileName) {
        FileCategory exact = MANIFEST_FILES.get(fileName);
        if (exact != null) return exact;
        for (Map.Entry<String, FileCategory> entry : MANIFEST_FILES.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(fileName)) return entry.getValue();
        }
        return null;
    }

    private static String fileName(String normalizedPath) {
        int slash = normalizedPath.lastIndexOf('/');
        return slash >= 0 ? normalizedPath.substring(slash + 1) : normalizedPath;
    }

    private static String extension(String lowerName) {
        int dot = lowerName.lastIndexOf('.');
        return dot > 0 ? lowerName.substring(dot) : "";
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
