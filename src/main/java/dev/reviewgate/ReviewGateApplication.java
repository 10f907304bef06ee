package dev.reviewgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ReviewGate: automated pull request review for Azure DevOps.
 *
 * <p>Pipeline overview:
 * <pre>
 * Tool call → ReviewToolService → ReviewOrchestrator.prepare
 *   → FileClassifier + SecurityPatternScanner + DependencyVulnerabilityAnalyzer
 *   → ReviewPromptAssembler → ReviewAgentClient (chat model)
 *   → ReviewResponseParser → ReviewPolicy → CommentConsolidator + VoteDecisionEngine
 *   → PostingOrchestrator → AzureDevOpsClient (threads + vote)
 * </pre>
 *
 * <p>Only one verdict is consolidated per invocation, and a PR is published at most once
 * per process lifetime.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReviewGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewGateApplication.class, args);
    }
}
