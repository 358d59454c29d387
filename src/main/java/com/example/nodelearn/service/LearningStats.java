package com.example.nodelearn.service;

import com.example.nodelearn.model.OwnerStats;
import com.example.nodelearn.model.SessionSummary;
import com.example.nodelearn.topic.TopicNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Summarizes an owner's archived sessions: totals, recent learning time, the current daily
 * streak and the most revisited starting topics.
 */
@Service
public class LearningStats {

    private static final Logger logger = LoggerFactory.getLogger(LearningStats.class);

    private static final int STREAK_LOOKBACK_DAYS = 30;
    private static final int FAVORITE_LIMIT = 3;
    private static final Duration LAST_WEEK = Duration.ofDays(7);
    private static final double MS_PER_HOUR = 3_600_000d;

    private final SessionHistoryStore historyStore;
    private final TopicNormalizer normalizer;
    private final Clock clock;

    public LearningStats(SessionHistoryStore historyStore, TopicNormalizer normalizer, Clock clock) {
        this.historyStore = historyStore;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public OwnerStats forOwner(String ownerRef) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant weekAgo = now.minus(LAST_WEEK);

        int sessionCount = 0;
        long nodesCreated = 0;
        long connections = 0;
        long dwellMs = 0;
        long dwellMsLastWeek = 0;
        Set<LocalDate> activeDays = new HashSet<>();
        Map<String, TopicTally> tallies = new LinkedHashMap<>();

        for (SessionSummary summary : historyStore.listByOwner(ownerRef)) {
            sessionCount++;
            nodesCreated += summary.getNodeCount() != null ? summary.getNodeCount() : 0;
            connections += summary.getCrossLinkCount() != null ? summary.getCrossLinkCount() : 0;
            long sessionDwell = summary.getTotalDwellMs() != null ? summary.getTotalDwellMs() : 0L;
            dwellMs += sessionDwell;

            Instant startedAt = summary.getStartedAt();
            if (startedAt != null) {
                if (!startedAt.isBefore(weekAgo)) {
                    dwellMsLastWeek += sessionDwell;
                }
                LocalDate day = LocalDate.ofInstant(startedAt, ZoneOffset.UTC);
                if (ChronoUnit.DAYS.between(day, today) <= STREAK_LOOKBACK_DAYS) {
                    activeDays.add(day);
                }
            }
            tally(tallies, summary);
        }

        OwnerStats stats = OwnerStats.builder()
                .ownerRef(ownerRef)
                .sessionCount(sessionCount)
                .nodesCreated(nodesCreated)
                .connections(connections)
                .learningHours(dwellMs / MS_PER_HOUR)
                .learningHoursLastWeek(dwellMsLastWeek / MS_PER_HOUR)
                .streakDays(streak(activeDays, today))
                .favoriteTopics(favorites(tallies))
                .build();
        logger.debug("Stats for {}: {} sessions, streak {}", ownerRef, sessionCount, stats.getStreakDays());
        return stats;
    }

    private void tally(Map<String, TopicTally> tallies, SessionSummary summary) {
        if (summary.getRootTopic() == null) {
            return;
        }
        String key = normalizer.canonicalKey(summary.getRootTopic());
        if (key.isEmpty()) {
            return;
        }
        TopicTally tally = tallies.computeIfAbsent(key, k -> new TopicTally());
        tally.count++;
        Instant startedAt = summary.getStartedAt() != null ? summary.getStartedAt() : Instant.MIN;
        if (tally.display == null || startedAt.isAfter(tally.lastStartedAt)) {
            tally.display = summary.getRootTopic();
            tally.lastStartedAt = startedAt;
        }
    }

    private static int streak(Set<LocalDate> activeDays, LocalDate today) {
        int streak = 0;
        LocalDate day = today;
        while (activeDays.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    private static List<String> favorites(Map<String, TopicTally> tallies) {
        return tallies.values().stream()
                .sorted(Comparator.comparingInt((TopicTally t) -> t.count).reversed()
                        .thenComparing((TopicTally t) -> t.lastStartedAt, Comparator.reverseOrder()))
                .limit(FAVORITE_LIMIT)
                .map(t -> t.display)
                .collect(Collectors.toList());
    }

    private static final class TopicTally {
        private int count;
        private String display;
        private Instant lastStartedAt = Instant.MIN;
    }
}
