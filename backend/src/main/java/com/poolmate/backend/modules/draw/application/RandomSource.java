package com.poolmate.backend.modules.draw.application;

/**
 * Source of uniformly distributed values in {@code [0, 1)} used by {@link SelectionAlgorithm}.
 */
@FunctionalInterface
public interface RandomSource {

    double nextDouble();
}
