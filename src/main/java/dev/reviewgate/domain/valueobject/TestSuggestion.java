package dev.reviewgate.domain.valueobject;

public record TestSuggestion(String testName, String description, String testCode, String filePath) {

    public TestSuggestion {
        if (testName == null) testName = "";
        if (description == null) description = "";
        if (testCode == null) testCode = "";
    }

    public TestSuggestion withFilePath(String path) {
        return new TestSuggestion(testName, description, testCode, path);
    }
}
