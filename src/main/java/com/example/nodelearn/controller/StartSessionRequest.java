package com.example.nodelearn.controller;

import com.example.nodelearn.suggest.ExplorationDepth;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {
    private String ownerRef;
    private String seedTopic;
    private Set<String> tags;
    private ExplorationDepth depth;
}
