package com.example.nodelearn.topic;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A concept identity. Two topics are equal when their normalized forms are equal,
 * whatever their display text.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Topic {

    @EqualsAndHashCode.Include
    private final String normalized;
    private final String display;

    Topic(String normalized, String display) {
        this.normalized = normalized;
        this.display = display;
    }
}
