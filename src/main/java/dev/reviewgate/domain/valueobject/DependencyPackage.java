package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.Ecosystem;

public record DependencyPackage(
        Ecosystem ecosystem, String name, String version, boolean vulnerable, String advisory
) {
    public static DependencyPackage of(Ecosystem ecosystem, String name, String version) {
        return new DependencyPackage(ecosystem, name, version, false, null);
    }

    public DependencyPackage flagged(String advisory) {
        return new DependencyPackage(ecosystem, name, version, true, advisory);
    }
}
