package com.example.nodelearn.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Set;

/**
 * Search projection of a {@link SessionRecord}. Derived from the record, never edited on its own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("archive")
public class ArchiveEntry {
    @Id
    private String sessionId;
    private String ownerRef;
    private Set<String> indexedTerms;
    private Set<String> tags;
    private Instant startedAt;
}
