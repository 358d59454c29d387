package com.example.nodelearn.model;

import com.example.nodelearn.tree.TreeSnapshot;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An ended exploration session as archived. Written once, never updated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sessions")
public class SessionRecord {
    @Id
    private String sessionId;
    @Indexed
    private String ownerRef;
    private Instant startedAt;
    private Instant endedAt;
    private String depth;
    private TreeSnapshot tree;
    private Map<String, Long> perNodeDwell;
    private Set<String> tags;

    // Denormalized for history listings
    private String rootTopic;
    private Integer nodeCount;
    private Integer crossLinkCount;
    private Long totalDwellMs;
}
