package com.example.nodelearn.repo;

import com.example.nodelearn.model.ArchiveEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ArchiveEntryRepo extends MongoRepository<ArchiveEntry, String> {}
