package com.trender.pipeline.loader;

import com.trender.pipeline.scoring.MetricsCalculator;
import com.trender.pipeline.scoring.ScoringPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Scores and ranks extracted staging rows.
 *
 * <p>Stars are normalized against the maximum of the row's own cohort (general or marker).
 * Overall and per-language ranks order by momentum descending, then stars descending, then
 * extraction order, so equal inputs always produce the same ranks.</p>
 */
public class RankingTransformer {

    private static final Logger logger = LoggerFactory.getLogger(RankingTransformer.class);

    private final ScoringPolicy policy;

    public RankingTransformer(ScoringPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param rows staging rows in extraction order
     * @param now  reference time for recency
     * @return one ranked entry per row, in the input order
     */
    public List<RankedRepository> transform(List<StagingRow> rows, Instant now) {
        if (rows.isEmpty()) {
            return List.of();
        }

        long generalMax = maxStars(rows, false);
        long markerMax = maxStars(rows, true);

        int size = rows.size();
        double[] recency = new double[size];
        double[] normalized = new double[size];
        double[] momentum = new double[size];
        for (int i = 0; i < size; i++) {
            StagingRow row = rows.get(i);
            recency[i] = MetricsCalculator.recencyScore(row.createdAt(), now);
            normalized[i] = MetricsCalculator.normalizedStars(row.stars(), row.isMarkerCohort() ? markerMax : generalMax);
            momentum[i] = policy.momentum(recency[i], normalized[i]);
        }

        Comparator<Integer> byStars = Comparator.comparingLong((Integer i) -> rows.get(i).stars()).reversed();
        Comparator<Integer> byMomentum = Comparator.comparingDouble((Integer i) -> momentum[i]).reversed()
                .thenComparing(byStars)
                .thenComparingInt(i -> i);

        int[] starRank = ranks(IntStream.range(0, size).boxed().toList(), byStars.thenComparingInt(i -> i), size);
        int[] overallRank = ranks(IntStream.range(0, size).boxed().toList(), byMomentum, size);

        Map<String, List<Integer>> byLanguage = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            byLanguage.computeIfAbsent(String.valueOf(rows.get(i).language()), k -> new ArrayList<>()).add(i);
        }
        int[] languageRank = new int[size];
        for (List<Integer> members : byLanguage.values()) {
            int[] ranked = ranks(members, byMomentum, size);
            for (int i : members) {
                languageRank[i] = ranked[i];
            }
        }

        List<RankedRepository> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            StagingRow row = rows.get(i);
            result.add(new RankedRepository(
                    row,
                    recency[i],
                    normalized[i],
                    momentum[i],
                    MetricsCalculator.starVelocity(row.stars(), row.starsGained()),
                    MetricsCalculator.activityScore(row.activity()),
                    starRank[i],
                    overallRank[i],
                    languageRank[i]));
        }

        logger.info("Ranked {} repositories across {} languages (general max stars {}, marker max stars {})",
                size, byLanguage.size(), generalMax, markerMax);
        return result;
    }

    private static long maxStars(List<StagingRow> rows, boolean markerCohort) {
        return rows.stream()
                .filter(r -> r.isMarkerCohort() == markerCohort)
                .mapToLong(StagingRow::stars)
                .max()
                .orElse(0L);
    }

    /**
     * Positions of {@code members} under {@code order}, 1-based, indexed by row index.
     */
    private static int[] ranks(List<Integer> members, Comparator<Integer> order, int size) {
        List<Integer> sorted = new ArrayList<>(members);
        sorted.sort(order);
        int[] ranks = new int[size];
        for (int position = 0; position < sorted.size(); position++) {
            ranks[sorted.get(position)] = position + 1;
        }
        return ranks;
    }
}
