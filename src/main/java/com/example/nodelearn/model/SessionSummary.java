package com.example.nodelearn.model;

import lombok.*;

import java.time.Instant;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionSummary {
    private String sessionId;
    private String ownerRef;
    private String rootTopic;
    private Instant startedAt;
    private Instant endedAt;
    private Integer nodeCount;
    private Integer crossLinkCount;
    private Long totalDwellMs;
    private Set<String> tags;
}
