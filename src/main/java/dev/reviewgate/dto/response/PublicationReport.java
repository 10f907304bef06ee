package dev.reviewgate.dto.response;

import java.util.List;

public record PublicationReport(
        String status, String severity, boolean approved, int vote,
        int commentsPosted, boolean voteUpdated, List<String> errors
) {}
