package com.example.nodelearn.archive;

import com.example.nodelearn.error.StoreUnavailableException;
import com.example.nodelearn.service.SessionHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads every archived entry into {@link ArchiveSearch} once the application is up.
 */
@Component
public class ArchiveIndexInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexInitializer.class);

    private final SessionHistoryStore historyStore;
    private final ArchiveSearch archiveSearch;

    public ArchiveIndexInitializer(SessionHistoryStore historyStore, ArchiveSearch archiveSearch) {
        this.historyStore = historyStore;
        this.archiveSearch = archiveSearch;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void rebuild() {
        try {
            archiveSearch.rebuild(historyStore.allEntries());
        } catch (StoreUnavailableException e) {
            // sessions archived from now on are still indexed as they end
            logger.error("Archive index rebuild skipped, store unavailable", e);
        }
    }
}
