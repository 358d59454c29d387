package com.example.nodelearn.suggest;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SuggestionRequest {
    String topic;
    // root first, ending with the parent of the expanded node
    List<String> contextPath;
    int maxResults;
}
