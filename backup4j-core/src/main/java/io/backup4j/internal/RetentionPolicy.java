package io.backup4j.internal;

import io.backup4j.BackupArtifact;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keep-newest-N selection over a destination listing.
 */
final class RetentionPolicy {

    private RetentionPolicy() {
    }

    /**
     * Artifacts to delete so that at most {@code keepN} of {@code sourceType} remain.
     * Artifacts of other source types are never selected. Ties on modification time keep
     * listing order.
     *
     * @param keepN 0 or less means unbounded; nothing is selected
     * @return oldest first
     */
    static List<BackupArtifact> selectExpired(List<BackupArtifact> listing, String sourceType, int keepN) {
        if (keepN <= 0) {
            return List.of();
        }
        List<BackupArtifact> sameType = listing.stream()
                .filter(a -> sourceType.equals(a.sourceType()))
                .sorted(Comparator.comparing(BackupArtifact::modified))
                .collect(Collectors.toList());

        int excess = sameType.size() - keepN;
        if (excess <= 0) {
            return List.of();
        }
        return List.copyOf(sameType.subList(0, excess));
    }
}
