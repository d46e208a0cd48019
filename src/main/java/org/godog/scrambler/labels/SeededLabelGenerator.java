package org.godog.scrambler.labels;

import org.apache.commons.math3.random.Well19937c;

import java.util.function.Predicate;

/**
 * Default {@link ILabelGenerator} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Labels have a fixed length, start with a letter and continue with letters, digits
 * and underscores, so they are valid identifiers in every supported file mode.
 */
public final class SeededLabelGenerator implements ILabelGenerator {

    private static final String FIRST_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String OTHER_CHARS = FIRST_CHARS + "0123456789_";
    private static final int MAX_ATTEMPTS_PER_LENGTH = 1000;

    private final Well19937c rng;
    private int length;

    /**
     * Creates a new seeded generator.
     * @param seed The seed of the underlying random number generator.
     * @param length The length of generated labels, at least 2.
     */
    public SeededLabelGenerator(long seed, int length) {
        if (length < 2) {
            throw new IllegalArgumentException("Label length must be at least 2 but was " + length);
        }
        this.rng = new Well19937c(seed);
        this.length = length;
    }

    @Override
    public String next(Predicate<String> rejected) {
        while (true) {
            for (int attempt = 0; attempt < MAX_ATTEMPTS_PER_LENGTH; attempt++) {
                String candidate = candidate();
                if (!rejected.test(candidate)) {
                    return candidate;
                }
            }
            // The label space of the current length is crowded; grow instead of spinning.
            length++;
        }
    }

    private String candidate() {
        StringBuilder sb = new StringBuilder(length);
        sb.append(FIRST_CHARS.charAt(rng.nextInt(FIRST_CHARS.length())));
        for (int i = 1; i < length; i++) {
            sb.append(OTHER_CHARS.charAt(rng.nextInt(OTHER_CHARS.length())));
        }
        return sb.toString();
    }
}
