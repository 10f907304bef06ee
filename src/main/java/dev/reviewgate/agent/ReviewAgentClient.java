package dev.reviewgate.agent;

/**
 * The external reviewer. Takes the assembled prompt and returns its raw reply, which is
 * expected (but not trusted) to be a JSON verdict.
 */
public interface ReviewAgentClient {

    String review(String prompt);
}
