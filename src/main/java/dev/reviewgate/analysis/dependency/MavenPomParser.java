package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.Ecosystem;
import dev.reviewgate.domain.valueobject.DependencyPackage;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code pom.xml}: {@code groupId:artifactId} with a literal version. Property
 * placeholders and managed (version-less) dependencies are skipped.
 */
@Component
public class MavenPomParser implements ManifestParser {

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.MAVEN;
    }

    @Override
    public boolean supports(String fileName) {
        return "pom.xml".equalsIgnoreCase(fileName);
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
        for (Element dep : XmlManifests.elements(doc, "dependency")) {
            String groupId = XmlManifests.childText(dep, "groupId");
            String artifactId = XmlManifests.childText(dep, "artifactId");
            String version = XmlManifests.childText(dep, "version");
            if (groupId == null || artifactId == null || version == null || version.isEmpty()) continue;
            if (version.contains("${")) continue;
            packages.add(DependencyPackage.of(Ecosystem.MAVEN, groupId + ":" + artifactId,
                    ManifestParser.normalizeVersion(version.replace("[", "").replace("(", ""))));
        }
        return ManifestParseResult.success(path, packages);
    }
}
