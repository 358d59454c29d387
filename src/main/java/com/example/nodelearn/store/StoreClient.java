package com.example.nodelearn.store;

import com.example.nodelearn.model.SessionSummary;

import java.util.List;

public interface StoreClient {
    /**
     * One page of an owner's archived sessions, most recent first, without tree snapshots.
     */
    List<SessionSummary> findSummariesByOwner(String ownerRef, int offset, int limit);
}
