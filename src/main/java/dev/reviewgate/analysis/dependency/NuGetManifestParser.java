package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.Ecosystem;
import dev.reviewgate.domain.valueobject.DependencyPackage;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code packages.config}, SDK-style project files and {@code Directory.Packages.props}.
 */
@Component
public class NuGetManifestParser implements ManifestParser {

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.NUGET;
    }

    @Override
    public boolean supports(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.equals("packages.config")
                || lower.equals("directory.packages.props")
                || lower.endsWith(".csproj")
                || lower.endsWith(".vbproj")
                || lower.endsWith(".fsproj");
    }

    @Override
    public ManifestParseResult parse(String path, String content) {
        Document doc;
        try {
            doc = XmlManifests.parse(content);
        } catch (Exception e) {
            return ManifestParseResult.failure(path, "invalid XML: " + e.getMessage());
        }

        List<DependencyPackage> packages = new ArrayList<>();
        for (Element pkg : XmlManifests.elements(doc, "package")) {
            add(packages, pkg.getAttribute("id"), pkg.getAttribute("version"));
        }
        for (String tag : List.of("PackageReference", "PackageVersion")) {
            for (Element ref : XmlManifests.elements(doc, tag)) {
                add(packages, ref.getAttribute("Include"), XmlManifests.attributeOrChild(ref, "Version"));
            }
        }
        return ManifestParseResult.success(path, packages);
    }

    private static void add(List<DependencyPackage> packages, String name, String version) {
        if (name == null || name.isBlank() || version == null || version.isBlank()) return;
        // version ranges like [1.0,2.0)
        String v = version.strip().replace("[", "").replace("(", "");
        packages.add(DependencyPackage.of(Ecosystem.NUGET, name.strip(), ManifestParser.normalizeVersion(v)));
    }
}
