package com.example.nodelearn.suggest;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExplanationRequest {
    String topic;
    // root first, ending with the parent of the explained node
    List<String> contextPath;
}
