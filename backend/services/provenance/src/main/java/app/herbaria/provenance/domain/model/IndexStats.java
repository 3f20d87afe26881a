package app.herbaria.provenance.domain.model;

public record IndexStats(
        long specimens,
        long sourceFiles,
        long transformations,
        long pendingAttempts,
        long completedAttempts,
        long failedAttempts,
        long flaggedSpecimens,
        long reviewDecisions
) {
}
