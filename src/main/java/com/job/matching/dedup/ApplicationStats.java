package com.job.matching.dedup;

import java.util.Map;

/**
 * Summary of the duplicate index.
 *
 * @param duplicatesDetected records stamped with a {@code duplicate_of} reference
 * @param recentApplications records applied within the last seven days
 */
public record ApplicationStats(
        int totalApplications,
        Map<String, Integer> byStatus,
        Map<String, Integer> byCompany,
        Map<String, Integer> bySource,
        int duplicatesDetected,
        int recentApplications
) {
    public ApplicationStats {
        byStatus = Map.copyOf(byStatus);
        byCompany = Map.copyOf(byCompany);
        bySource = Map.copyOf(bySource);
    }

    public static ApplicationStats empty() {
        return new ApplicationStats(0, Map.of(), Map.of(), Map.of(), 0, 0);
    }
}
