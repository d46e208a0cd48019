package org.godog.scrambler.labels;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LabelAllocator}.
 */
public class LabelAllocatorTest {

    /**
     * Verifies that the first request for an identifier fixes its label for the rest of the run.
     */
    @Test
    @Tag("unit")
    void testPublicLabelsAreIdempotent() {
        LabelAllocator labels = new LabelAllocator(new SeededLabelGenerator(42, 8), new BannedLabels(List.of()));

        String first = labels.get("health");
        String second = labels.get("health");

        assertThat(second).isEqualTo(first);
        assertThat(labels.has("health")).isTrue();
        assertThat(labels.has("coins")).isFalse();
        assertThat(labels.size()).isEqualTo(1);
        assertThat(labels.snapshot()).containsEntry("health", first);
    }

    /**
     * Verifies that public and fresh labels never collide.
     */
    @Test
    @Tag("unit")
    void testLabelsAreUnique() {
        LabelAllocator labels = new LabelAllocator(new SeededLabelGenerator(7, 2), new BannedLabels(List.of()));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            assertThat(seen.add(labels.get("name" + i))).isTrue();
            assertThat(seen.add(labels.fresh())).isTrue();
        }
        assertThat(labels.size()).isEqualTo(500);
    }

    /**
     * Verifies that a banned or already issued candidate is rejected by the allocator.
     */
    @Test
    @Tag("unit")
    void testBannedAndIssuedCandidatesAreRejected() {
        Deque<String> candidates = new ArrayDeque<>(List.of("self", "alpha", "alpha", "beta"));
        ILabelGenerator scripted = rejected -> {
            while (true) {
                String candidate = candidates.poll();
                if (!rejected.test(candidate)) return candidate;
            }
        };
        LabelAllocator labels = new LabelAllocator(scripted, new BannedLabels(List.of("self")));

        assertThat(labels.get("health")).isEqualTo("alpha");
        assertThat(labels.fresh()).isEqualTo("beta");
    }

    @Test
    @Tag("unit")
    void testSameSeedGivesSameLabels() {
        LabelAllocator a = new LabelAllocator(new SeededLabelGenerator(1337, 8), new BannedLabels(List.of()));
        LabelAllocator b = new LabelAllocator(new SeededLabelGenerator(1337, 8), new BannedLabels(List.of()));

        assertThat(List.of(a.get("health"), a.fresh(), a.get("coins")))
                .isEqualTo(List.of(b.get("health"), b.fresh(), b.get("coins")));
    }
}
