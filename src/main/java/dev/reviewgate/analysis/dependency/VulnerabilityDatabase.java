package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.enums.Ecosystem;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Small hardcoded table of well-known vulnerable package ranges, keyed by
 * (ecosystem, lower-case package name).
 */
@Component
public class VulnerabilityDatabase {

    public record Advisory(String id, VersionConstraint constraint) {}

    private final Map<String, Advisory> advisories = new HashMap<>();

    public VulnerabilityDatabase() {
        register(Ecosystem.NPM, "lodash", "4.17.21", "CVE-2021-23337");
        register(Ecosystem.NPM, "minimist", "1.2.6", "CVE-2021-44906");
        register(Ecosystem.NPM, "axios", "0.21.1", "CVE-2020-28168");
        register(Ecosystem.NPM, "jquery", "3.5.0", "CVE-2020-11022");

        register(Ecosystem.PYPI, "django", "3.2.14", "CVE-2022-34265");
        register(Ecosystem.PYPI, "requests", "2.31.0", "CVE-2023-32681");
        register(Ecosystem.PYPI, "pyyaml", "5.4", "CVE-2020-14343");

        register(Ecosystem.NUGET, "Newtonsoft.Json", "13.0.1", "GHSA-5crp-9r3c-p9vr");
        register(Ecosystem.NUGET, "System.Text.Encodings.Web", "4.5.1", "CVE-2021-26701");

        register(Ecosystem.MAVEN, "org.apache.logging.log4j:log4j-core", "2.17.1", "CVE-2021-44832");
        register(Ecosystem.MAVEN, "com.fasterxml.jackson.core:jackson-databind", "2.13.4.2", "CVE-2022-42003");
        register(Ecosystem.MAVEN, "org.springframework:spring-beans", "5.3.18", "CVE-2022-22965");
    }

    /** Advisory affecting this exact version, if any. */
    public Optional<Advisory> lookup(Ecosystem ecosystem, String name, String version) {
        Advisory advisory = advisories.get(key(ecosystem, name));
        if (advisory == null || !advisory.constraint().isAffected(version)) return Optional.empty();
        return Optional.of(advisory);
    }

    private void register(Ecosystem ecosystem, String name, String fixedIn, String advisoryId) {
        advisories.put(key(ecosystem, name), new Advisory(advisoryId, VersionConstraint.below(fixedIn)));
    }

    private static String key(Ecosystem ecosystem, String name) {
        return ecosystem.label() + ":" + name.toLowerCase(Locale.ROOT);
    }
}
