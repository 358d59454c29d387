package com.example.nodelearn.repo;

import com.example.nodelearn.model.SessionRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SessionRecordRepo extends MongoRepository<SessionRecord, String> {}
