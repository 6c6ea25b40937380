package com.streamfirst.history.domain;

import lombok.Getter;

/**
 * A channel session stopped making pagination progress: either it used up its iteration
 * ceiling or the upstream answered a full batch made only of records already seen.
 * Fatal for that channel only.
 */
@Getter
public class SafetyCapExceededException extends RuntimeException {

    private final String channel;
    private final int iterations;

    public SafetyCapExceededException(String channel, int iterations, String message) {
        super(message);
        this.channel = channel;
        this.iterations = iterations;
    }
}
