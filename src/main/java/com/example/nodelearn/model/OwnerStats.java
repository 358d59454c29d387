package com.example.nodelearn.model;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OwnerStats {
    private String ownerRef;
    private int sessionCount;
    private long nodesCreated;
    private long connections;
    private double learningHours;
    private double learningHoursLastWeek;
    private int streakDays;
    private List<String> favoriteTopics;
}
