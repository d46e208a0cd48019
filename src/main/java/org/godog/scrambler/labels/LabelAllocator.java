package org.godog.scrambler.labels;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The run-wide allocator of opaque labels.
 * <p>
 * Public labels are memoized per source identifier: the first request for an identifier fixes
 * its label for the rest of the run, which keeps references consistent across files.
 * Private labels are handed out by {@link #fresh()} and are never reused for anything else.
 * The allocator is append-only and not thread-safe; a run must use it from a single thread.
 */
public class LabelAllocator {

    private final ILabelGenerator generator;
    private final BannedLabels bannedLabels;
    private final Map<String, String> publicLabels = new LinkedHashMap<>();
    private final Set<String> issued = new HashSet<>();

    /**
     * Creates a new allocator.
     * @param generator The strategy producing opaque identifiers.
     * @param bannedLabels Names that must never be produced as labels.
     */
    public LabelAllocator(ILabelGenerator generator, BannedLabels bannedLabels) {
        this.generator = generator;
        this.bannedLabels = bannedLabels;
    }

    /**
     * Returns the public label for a source identifier, allocating it on first request.
     * @param source The source identifier.
     * @return The opaque label, identical for every call with the same source within this run.
     */
    public String get(String source) {
        String label = publicLabels.get(source);
        if (label == null) {
            label = fresh();
            publicLabels.put(source, label);
        }
        return label;
    }

    /**
     * Checks whether a public label has already been allocated for a source identifier.
     * @param source The source identifier.
     * @return {@code true} if {@link #get(String)} was called for it before.
     */
    public boolean has(String source) {
        return publicLabels.containsKey(source);
    }

    /**
     * Allocates a label that is not bound to any source identifier.
     * @return A label distinct from every label issued before in this run.
     */
    public String fresh() {
        String label = generator.next(candidate -> issued.contains(candidate) || bannedLabels.contains(candidate));
        issued.add(label);
        return label;
    }

    /**
     * Returns the number of public labels allocated so far.
     * @return The size of the public mapping.
     */
    public int size() {
        return publicLabels.size();
    }

    /**
     * Returns an unmodifiable view of the public mapping in allocation order.
     * @return Source identifier to label.
     */
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(publicLabels);
    }
}
