package com.poolmate.backend.modules.draw.application;

import java.util.List;

/**
 * @param randomValue raw value drawn from the random source, kept for audit replay
 * @param candidates the exact list the index refers to
 */
public record Selection<T>(T winner, double randomValue, int index, List<T> candidates) {
}
