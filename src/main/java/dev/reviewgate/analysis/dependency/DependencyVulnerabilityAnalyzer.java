package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.enums.Ecosystem;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.DependencyPackage;
import dev.reviewgate.domain.valueobject.DependencySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort scan of changed dependency manifests against {@link VulnerabilityDatabase}.
 * A manifest that cannot be parsed is skipped; analysis never fails the review.
 */
@Component
public class DependencyVulnerabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyVulnerabilityAnalyzer.class);

    private final List<ManifestParser> parsers;
    private final VulnerabilityDatabase database;

    public DependencyVulnerabilityAnalyzer(List<ManifestParser> parsers, VulnerabilityDatabase database) {
        this.parsers = parsers;
        this.database = database;
    }

    public DependencyAnalysis analyze(List<Change> changes) {
        int total = 0;
        Map<Ecosystem, Integer> perEcosystem = new EnumMap<>(Ecosystem.class);
        List<String> vulnerableList = new ArrayList<>();
        List<String> issues = new ArrayList<>();

        for (Change change : changes) {
            if (change.changeType() == ChangeType.DELETE || change.newContent().isBlank()) continue;
            Optional<ManifestParser> parser = parserFor(change.path());
            if (parser.isEmpty()) continue;

            ManifestParseResult result = parser.get().parse(change.path(), change.newContent());
            if (!result.isSuccess()) {
                log.debug("Skipping manifest {}: {}", change.path(), result.failureReason());
                continue;
            }

            for (DependencyPackage pkg : result.packages()) {
                total++;
                perEcosystem.merge(pkg.ecosystem(), 1, Integer::sum);

                Optional<VulnerabilityDatabase.Advisory> advisory =
                        database.lookup(pkg.ecosystem(), pkg.name(), pkg.version());
                if (advisory.isEmpty()) continue;

                DependencyPackage flagged = pkg.flagged(advisory.get().id());
                String entry = "%s@%s (%s): %s".formatted(
                        flagged.name(), flagged.version(), flagged.ecosystem().label(), flagged.advisory());
                vulnerableList.add(entry);
                issues.add("CRITICAL: Vulnerable dependency %s in %s, upgrade to %s or later"
                        .formatted(entry, change.path(), advisory.get().constraint().fixedIn()));
            }
        }

        Map<String, Integer> byType = new LinkedHashMap<>();
        perEcosystem.forEach((ecosystem, count) -> byType.put(ecosystem.label(), count));

        if (total > 0)
            log.info("Examined {} package(s), {} vulnerable", total, vulnerableList.size());

        DependencySummary summary = new DependencySummary(total, byType, vulnerableList.size(),
                List.copyOf(vulnerableList), !vulnerableList.isEmpty());
        return new DependencyAnalysis(summary, issues);
    }

    private Optional<ManifestParser> parserFor(String path) {
        String normalized = path.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return parsers.stream().filter(p -> p.supports(fileName)).findFirst();
    }
}
