package com.example.nodelearn.suggest;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionCandidate {
    private String candidateTopic;
    private String rationale;

    public static SuggestionCandidate of(String candidateTopic) {
        return new SuggestionCandidate(candidateTopic, null);
    }
}
