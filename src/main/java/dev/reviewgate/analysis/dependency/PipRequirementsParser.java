package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.Ecosystem;
import dev.reviewgate.domain.valueobject.DependencyPackage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code requirements*.txt}: one requirement per line. Only pinned or lower-bounded
 * entries carry a version; bare names are skipped.
 */
@Component
public class PipRequirementsParser implements ManifestParser {

    private static final Pattern REQUIREMENT = Pattern.compile(
            "^([A-Za-z0-9][A-Za-z0-9._-]*)(?:\\[[^\\]]*\\])?\\s*(==|>=|~=|===)\\s*([^;#\\s]+)");

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.PYPI;
    }

    @Override
    public boolean supports(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.startsWith("requirements") && lower.endsWith(".txt");
    }

    @Override
    public ManifestParseResult parse(String path, String content) {
        List<DependencyPackage> packages = new ArrayList<>();
        for (String raw : content.split("\n")) {
            String line = raw.strip();
            // comments and pip options such as -r, -e, --index-url
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("-")) continue;
            Matcher m = REQUIREMENT.matcher(line);
            if (!m.find()) continue;
            packages.add(DependencyPackage.of(Ecosystem.PYPI, m.group(1),
                    ManifestParser.normalizeVersion(m.group(3))));
        }
        return ManifestParseResult.success(path, packages);
    }
}
