package dev.reviewgate.domain.enums;

/**
 * Package ecosystems whose manifests are analyzed for vulnerable dependencies.
 */
public enum Ecosystem {
    NPM("npm"), PYPI("pypi"), NUGET("nuget"), MAVEN("maven");

    private final String label;

    Ecosystem(String label) { this.label = label; }

    public String label() { return label; }
}
