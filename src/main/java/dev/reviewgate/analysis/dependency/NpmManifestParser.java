package dev.reviewgate.analysis.dependency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewgate.domain.enums.Ecosystem;
import dev.reviewgate.domain.valueobject.DependencyPackage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** {@code package.json}: every dependency section, name to version range. */
@Component
public class NpmManifestParser implements ManifestParser {

    private static final List<String> SECTIONS = List.of(
            "dependencies", "devDependencies", "peerDependencies", "optionalDependencies");

    private final ObjectMapper objectMapper;

    public NpmManifestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.NPM;
    }

    @Override
    public boolean supports(String fileName) {
        return "package.json".equalsIgnoreCase(fileName);
    }

    @Override
    public ManifestParseResult parse(String path, String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return ManifestParseResult.failure(path, "invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject())
            return ManifestParseResult.failure(path, "top-level value is not an object");

        List<DependencyPackage> packages = new ArrayList<>();
        for (String section : SECTIONS) {
            JsonNode deps = root.get(section);
            if (deps == null || !deps.isObject()) continue;
            Iterator<Map.Entry<String, JsonNode>> fields = deps.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (!entry.getValue().isTextual()) continue;
                packages.add(DependencyPackage.of(Ecosystem.NPM, entry.getKey(),
                        ManifestParser.normalizeVersion(entry.getValue().asText())));
            }
        }
        return ManifestParseResult.success(path, packages);
    }
}
