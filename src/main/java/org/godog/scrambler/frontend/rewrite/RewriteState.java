package org.godog.scrambler.frontend.rewrite;

import org.godog.scrambler.labels.LabelAllocator;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-file state of the rewrite engine. Created when a file starts and discarded when it ends.
 */
public class RewriteState {

    private int scopeFloor = 0;
    private boolean inSpecialBlock = false;
    private final Map<String, String> privateLabels = new LinkedHashMap<>();
    private final Set<String> explicitPrivateLabels = new HashSet<>();

    public int getScopeFloor() {
        return scopeFloor;
    }

    /**
     * Moves the scope floor to the body depth of a newly entered inner class.
     * @param depth The indentation depth of the class body.
     */
    public void enterClassBody(int depth) {
        this.scopeFloor = depth;
    }

    /**
     * Lowers the scope floor if a declaration sits at a smaller depth.
     * @param depth The indentation depth of the declaration.
     */
    public void lowerScopeFloor(int depth) {
        if (depth < scopeFloor) {
            scopeFloor = depth;
        }
    }

    public boolean isInSpecialBlock() {
        return inSpecialBlock;
    }

    /**
     * Flips between normal rewriting and deleting everything.
     * @return The new state.
     */
    public boolean toggleSpecialBlock() {
        inSpecialBlock = !inSpecialBlock;
        return inSpecialBlock;
    }

    /**
     * Returns the private label of a source identifier, allocating one on first request.
     * @param source The source identifier.
     * @param explicit Whether the identifier was declared private by a directive.
     * @param labels The allocator fresh labels are taken from.
     * @return The private label, stable within this file.
     */
    public String getOrAddPrivateLabel(String source, boolean explicit, LabelAllocator labels) {
        String label = privateLabels.computeIfAbsent(source, s -> labels.fresh());
        if (explicit) {
            explicitPrivateLabels.add(source);
        }
        return label;
    }

    /**
     * @param source The source identifier.
     * @return The private label, or {@code null} if the identifier is not private in this file.
     */
    public String getPrivateLabel(String source) {
        return privateLabels.get(source);
    }

    public boolean isExplicitlyPrivate(String source) {
        return explicitPrivateLabels.contains(source);
    }
}
