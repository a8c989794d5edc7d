package com.poolmate.backend.modules.draw.application;

import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Uniform pick over a finalized candidate list. Results are not reproducible across runs;
 * only the recorded value and index are.
 */
@Component
public class SelectionAlgorithm {

    private final RandomSource randomSource;

    public SelectionAlgorithm(RandomSource randomSource) {
        this.randomSource = randomSource;
    }

    public <T> Selection<T> select(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("selection requires at least one candidate");
        }
        List<T> frozen = List.copyOf(candidates);
        double value = randomSource.nextDouble();
        if (value < 0.0 || value >= 1.0 || Double.isNaN(value)) {
            throw new IllegalStateException("random source returned " + value + ", expected a value in [0, 1)");
        }
        int index = (int) Math.floor(value * frozen.size());
        return new Selection<>(frozen.get(index), value, index, frozen);
    }
}
