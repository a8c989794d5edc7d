package com.poolmate.backend.modules.draw.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SelectionAlgorithmTest {

    @Test
    @DisplayName("후보가 한 명이면 그 후보가 당첨된다")
    void singleCandidate() {
        Selection<String> selection = new SelectionAlgorithm(() -> 0.999).select(List.of("solo"));

        assertThat(selection.winner()).isEqualTo("solo");
        assertThat(selection.index()).isZero();
    }

    @Test
    @DisplayName("빈 후보 목록은 거부된다")
    void emptyCandidates() {
        assertThatThrownBy(() -> new SelectionAlgorithm(() -> 0.5).select(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("난수 값이 후보 인덱스를 결정하고 감사용으로 보존된다")
    void indexFollowsRandomValue() {
        List<String> candidates = List.of("a", "b", "c", "d");

        Selection<String> selection = new SelectionAlgorithm(() -> 0.74).select(candidates);

        assertThat(selection.index()).isEqualTo(2);
        assertThat(selection.winner()).isEqualTo("c");
        assertThat(selection.randomValue()).isEqualTo(0.74);
        assertThat(selection.candidates()).containsExactlyElementsOf(candidates);
    }

    @Test
    @DisplayName("범위를 벗어난 난수는 오류로 처리된다")
    void rejectsOutOfRangeValue() {
        assertThatThrownBy(() -> new SelectionAlgorithm(() -> 1.0).select(List.of("a", "b")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new SelectionAlgorithm(() -> -0.1).select(List.of("a", "b")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new SelectionAlgorithm(() -> Double.NaN).select(List.of("a", "b")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("선택 이후 원본 목록을 바꿔도 기록된 후보는 변하지 않는다")
    void candidatesAreFrozen() {
        List<String> candidates = new ArrayList<>(List.of("a", "b"));

        Selection<String> selection = new SelectionAlgorithm(() -> 0.0).select(candidates);
        candidates.add("c");

        assertThat(selection.candidates()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("4명 후보에 대한 40000회 추첨은 균등하게 분포한다")
    void uniformDistribution() {
        Random random = new Random(20260302L);
        SelectionAlgorithm algorithm = new SelectionAlgorithm(random::nextDouble);
        List<Integer> candidates = List.of(0, 1, 2, 3);
        int[] wins = new int[4];

        for (int i = 0; i < 40_000; i++) {
            wins[algorithm.select(candidates).winner()]++;
        }

        for (int count : wins) {
            assertThat(count).isBetween(9_500, 10_500);
        }
    }
}
