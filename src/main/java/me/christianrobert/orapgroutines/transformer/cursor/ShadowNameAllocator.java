package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Derives shadow variable names from cursor names.
 *
 * <p>Names are {@code <cursor>__isopen}, {@code <cursor>__found} and {@code last__rowcount}.
 * A name already used by the routine, or allocated earlier, gets the first free suffix
 * {@code _2}, {@code _3}, ... Allocation follows the analysis order, so the same routine
 * always gets the same names.
 *
 * <p>A hoisted package cursor keeps its own name unless the routine declares that name
 * somewhere; then it is renamed the same way ({@code c1_2}) and its flags follow the new name.
 */
public class ShadowNameAllocator {

    public static final String ROW_COUNT_NAME = "last__rowcount";
    public static final String OPEN_FLAG_SUFFIX = "__isopen";
    public static final String FOUND_FLAG_SUFFIX = "__found";

    private final Set<String> taken;

    /**
     * @param routineIdentifiers folded identifiers already present in the routine
     */
    public ShadowNameAllocator(Set<String> routineIdentifiers) {
        this.taken = new HashSet<>(routineIdentifiers);
    }

    /**
     * Returns a name derived from the base that collides with nothing seen so far,
     * and reserves it.
     */
    public String allocate(String baseName) {
        String base = NameNormalizer.normalizeIdentifier(baseName);
        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        taken.add(candidate);
        return candidate;
    }

    /**
     * Allocates everything the analyzed routine needs: names for hoisted package cursors,
     * the shared row count when it is read, and per cursor the flags for the attributes
     * it queries.
     */
    public ShadowState allocate(CursorAnalysis analysis) {
        Map<String, String> hoistedCursorNames = new LinkedHashMap<>();
        for (CursorUsage hoisted : analysis.getHoistedCursors()) {
            String name = hoisted.getFoldedName();
            if (analysis.getDeclaredNames().contains(name)) {
                name = allocate(name);
            } else {
                taken.add(name);
            }
            hoistedCursorNames.put(hoisted.getKey(), name);
        }

        String rowCountName = analysis.requiresRowCount() ? allocate(ROW_COUNT_NAME) : null;

        Map<String, String> openFlags = new LinkedHashMap<>();
        Map<String, String> foundFlags = new LinkedHashMap<>();
        for (CursorUsage usage : analysis.getUsages()) {
            String cursorName = hoistedCursorNames.getOrDefault(usage.getKey(), usage.getFoldedName());
            if (usage.needsOpenFlag()) {
                openFlags.put(usage.getKey(), allocate(cursorName + OPEN_FLAG_SUFFIX));
            }
            if (usage.needsFoundFlag()) {
                foundFlags.put(usage.getKey(), allocate(cursorName + FOUND_FLAG_SUFFIX));
            }
        }
        return new ShadowState(openFlags, foundFlags, rowCountName, hoistedCursorNames);
    }
}
