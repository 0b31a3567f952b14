package com.lead.discovery.matching;

/**
 * Aggregate figures over stored matches, optionally for one service.
 *
 * @param serviceId        service the figures cover, null for all
 * @param totalMatches     number of matches
 * @param averageScore     mean match score, 0 when there are none
 * @param contactedCount   matches with status CONTACTED
 * @param interestedCount  matches with status INTERESTED
 * @param convertedCount   matches with status CONVERTED
 * @param highScoreCount   score of 80 or more
 * @param mediumScoreCount score from 60 up to 80
 * @param lowScoreCount    score under 60
 */
public record MatchAnalytics(
        String serviceId,
        long totalMatches,
        double averageScore,
        long contactedCount,
        long interestedCount,
        long convertedCount,
        long highScoreCount,
        long mediumScoreCount,
        long lowScoreCount
) {

    public double conversionRate() {
        return totalMatches == 0 ? 0.0 : (double) convertedCount / totalMatches;
    }
}
