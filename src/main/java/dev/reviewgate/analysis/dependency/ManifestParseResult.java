package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.valueobject.DependencyPackage;

import java.util.List;

/**
 * Outcome of parsing one manifest file: either the packages it declares or the reason it
 * could not be read.
 */
public record ManifestParseResult(String path, List<DependencyPackage> packages, String failureReason) {

    public ManifestParseResult {
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    public static ManifestParseResult success(String path, List<DependencyPackage> packages) {
        return new ManifestParseResult(path, packages, null);
    }

    public static ManifestParseResult failure(String path, String reason) {
        return new ManifestParseResult(path, List.of(), reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
