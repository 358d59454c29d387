package com.example.nodelearn.store;

import com.example.nodelearn.model.SessionRecord;
import com.example.nodelearn.model.SessionSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class MongoStoreClient implements StoreClient {

    private final MongoTemplate mongo;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<SessionSummary> findSummariesByOwner(String ownerRef, int offset, int limit) {
        Query q = new Query(Criteria.where("ownerRef").is(ownerRef))
                .with(Sort.by(Sort.Order.desc("startedAt"), Sort.Order.asc("_id")))
                .skip(offset)
                .limit(limit);
        // the tree snapshot and dwell map are the bulk of a record
        q.fields().exclude("tree").exclude("perNodeDwell");

        List<SessionRecord> records = mongo.find(q, SessionRecord.class);
        return records.stream()
                .map(r -> SessionSummary.builder()
                        .sessionId(r.getSessionId())
                        .ownerRef(r.getOwnerRef())
                        .rootTopic(r.getRootTopic())
                        .startedAt(r.getStartedAt())
                        .endedAt(r.getEndedAt())
                        .nodeCount(r.getNodeCount())
                        .crossLinkCount(r.getCrossLinkCount())
                        .totalDwellMs(r.getTotalDwellMs())
                        .tags(r.getTags())
                        .build())
                .collect(Collectors.toList());
    }
}
