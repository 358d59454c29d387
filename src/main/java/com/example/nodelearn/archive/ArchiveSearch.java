package com.example.nodelearn.archive;

import com.example.nodelearn.model.ArchiveEntry;
import com.example.nodelearn.topic.TopicNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory index over archived sessions.
 *
 * <p>A query scores each entry by how many distinct query tokens appear in its indexed terms; ties go
 * to the more recent session. A tag filter keeps only entries carrying every requested tag and is
 * applied before scoring. Tags and tokens compare in normalized form.</p>
 */
@Service
public class ArchiveSearch {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveSearch.class);

    private final TopicNormalizer normalizer;
    private final Map<String, Indexed> entries = new ConcurrentHashMap<>();

    public ArchiveSearch(TopicNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Adds or replaces the entry for its sessionId.
     */
    public void index(ArchiveEntry entry) {
        entries.put(entry.getSessionId(), new Indexed(entry, normalizeTags(entry.getTags())));
        logger.debug("Indexed session {} ({} terms)", entry.getSessionId(),
                entry.getIndexedTerms() == null ? 0 : entry.getIndexedTerms().size());
    }

    public void remove(String sessionId) {
        entries.remove(sessionId);
    }

    public void rebuild(Collection<ArchiveEntry> all) {
        entries.clear();
        all.forEach(this::index);
        logger.info("Archive index rebuilt with {} sessions", entries.size());
    }

    public int size() {
        return entries.size();
    }

    /**
     * @param query free text; blank matches every entry that passes the tag filter
     * @param tags  required tags, may be {@code null} or empty
     * @return sessionIds by descending relevance, then descending start time
     */
    public List<String> search(String query, Set<String> tags) {
        Set<String> requiredTags = normalizeTags(tags);
        List<String> queryTokens = normalizer.tokenize(query);

        List<Scored> hits = new ArrayList<>();
        for (Indexed indexed : entries.values()) {
            if (!indexed.tags.containsAll(requiredTags)) {
                continue;
            }
            int score = overlap(queryTokens, indexed.entry.getIndexedTerms());
            if (score == 0 && !queryTokens.isEmpty()) {
                continue;
            }
            hits.add(new Scored(indexed.entry, score));
        }

        hits.sort(Comparator.comparingInt(Scored::score).reversed()
                .thenComparing(s -> s.entry().getStartedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                .thenComparing(s -> s.entry().getSessionId()));
        logger.debug("Archive search '{}' tags {} -> {} hits", query, requiredTags, hits.size());
        return hits.stream().map(s -> s.entry().getSessionId()).collect(Collectors.toList());
    }

    private static int overlap(List<String> queryTokens, Set<String> terms) {
        if (terms == null) {
            return 0;
        }
        int score = 0;
        for (String token : queryTokens) {
            if (terms.contains(token)) {
                score++;
            }
        }
        return score;
    }

    private Set<String> normalizeTags(Collection<String> tags) {
        Set<String> normalized = new HashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                String key = normalizer.canonicalKey(tag);
                if (!key.isEmpty()) {
                    normalized.add(key);
                }
            }
        }
        return normalized;
    }

    private static final class Indexed {
        private final ArchiveEntry entry;
        private final Set<String> tags;

        private Indexed(ArchiveEntry entry, Set<String> tags) {
            this.entry = entry;
            this.tags = tags;
        }
    }

    private static final class Scored {
        private final ArchiveEntry entry;
        private final int score;

        private Scored(ArchiveEntry entry, int score) {
            this.entry = entry;
            this.score = score;
        }

        ArchiveEntry entry() {
            return entry;
        }

        int score() {
            return score;
        }
    }
}
