package dev.reviewgate.domain.enums;

import java.util.List;
import java.util.Locale;

/**
 * Language/purpose tag assigned to each changed file.
 *
 * <p>Significant categories are the code-bearing ones: language sources and their test
 * variants. Manifests, markup and config files never trigger a mixed review on their own.
 */
public enum FileCategory {
    CSHARP(true),
    RAZOR_VIEW(true),
    JAVASCRIPT(true),
    TYPESCRIPT(true),
    SQL(true),
    PYTHON(true),
    JAVA(true),
    TEST_CSHARP(true),
    TEST_JAVASCRIPT(true),
    TEST_PYTHON(true),
    TEST_JAVA(true),
    MARKDOWN(false),
    HTML(false),
    XML(false),
    CSS(false),
    JSON(false),
    YAML(false),
    CONFIG(false),
    PACKAGE_JAVASCRIPT(false),
    PACKAGE_CSHARP(false),
    PACKAGE_PYTHON(false),
    PACKAGE_JAVA(false),
    DEFAULT(false);

    /** Order in which significant categories are considered when picking the dominant one. */
    public static final List<FileCategory> SIGNIFICANT_PRIORITY = List.of(
            CSHARP, RAZOR_VIEW, TYPESCRIPT, JAVASCRIPT, JAVA, PYTHON, SQL,
            TEST_CSHARP, TEST_JAVASCRIPT, TEST_JAVA, TEST_PYTHON);

    private final boolean significant;

    FileCategory(boolean significant) {
        this.significant = significant;
    }

    public boolean isSignificant() {
        return significant;
    }

    public boolean isTest() {
        return name().startsWith("TEST_");
    }

    public boolean isPackageManifest() {
        return name().startsWith("PACKAGE_");
    }

    /** Test variant of a language category, or the category itself when none exists. */
    public FileCategory testVariant() {
        return switch (this) {
            case CSHARP -> TEST_CSHARP;
            case JAVASCRIPT, TYPESCRIPT -> TEST_JAVASCRIPT;
            case PYTHON -> TEST_PYTHON;
            case JAVA -> TEST_JAVA;
            default -> this;
        };
    }

    /** Stable lower-case identifier, e.g. {@code test_csharp}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Human-readable title, e.g. {@code Test Csharp}. */
    public String title() {
        StringBuilder sb = new StringBuilder();
        for (String part : id().split("_")) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }
}
