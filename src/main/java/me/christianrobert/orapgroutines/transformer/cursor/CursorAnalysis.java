package me.christianrobert.orapgroutines.transformer.cursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of analyzing one routine body: cursor usages in declaration order, the
 * implicit SQL cursor, the statements that refresh the row count and the attribute
 * references that could not be resolved.
 *
 * <p>Positions are statement ordinals of the original body. Resolution is recorded per
 * statement so the rewriter applies it without resolving names again: for each
 * OPEN/CLOSE/FETCH the key of its cursor, and for each statement the keys of its
 * attribute references in token order (null where unresolved).
 */
public class CursorAnalysis {

    private final String routineName;
    private final List<CursorUsage> usages;
    private final CursorUsage implicitCursor;
    private final Map<Integer, String> cursorKeyByStatement;
    private final Map<Integer, List<String>> referenceKeysByStatement;
    private final Set<Integer> rowCountRefreshOrdinals;
    private final List<AttributeReferenceSite> unresolvedReferences;
    private final Set<String> routineIdentifiers;
    private final Set<String> declaredNames;

    CursorAnalysis(String routineName,
                   List<CursorUsage> usages,
                   CursorUsage implicitCursor,
                   Map<Integer, String> cursorKeyByStatement,
                   Map<Integer, List<String>> referenceKeysByStatement,
                   Set<Integer> rowCountRefreshOrdinals,
                   List<AttributeReferenceSite> unresolvedReferences,
                   Set<String> routineIdentifiers,
                   Set<String> declaredNames) {
        this.routineName = routineName;
        this.usages = Collections.unmodifiableList(new ArrayList<>(usages));
        this.implicitCursor = implicitCursor;
        this.cursorKeyByStatement = Collections.unmodifiableMap(new HashMap<>(cursorKeyByStatement));
        Map<Integer, List<String>> references = new HashMap<>();
        for (Map.Entry<Integer, List<String>> entry : referenceKeysByStatement.entrySet()) {
            references.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.referenceKeysByStatement = Collections.unmodifiableMap(references);
        this.rowCountRefreshOrdinals = Collections.unmodifiableSet(new TreeSet<>(rowCountRefreshOrdinals));
        this.unresolvedReferences = Collections.unmodifiableList(new ArrayList<>(unresolvedReferences));
        this.routineIdentifiers = Collections.unmodifiableSet(new TreeSet<>(routineIdentifiers));
        this.declaredNames = Collections.unmodifiableSet(new TreeSet<>(declaredNames));
    }

    public String getRoutineName() {
        return routineName;
    }

    /**
     * Explicit cursors in order: routine declarations, nested block declarations
     * (pre-order), then the package cursors the routine uses.
     */
    public List<CursorUsage> getUsages() {
        return usages;
    }

    public CursorUsage getUsage(String key) {
        if (CursorUsage.IMPLICIT_CURSOR_KEY.equals(key)) {
            return implicitCursor;
        }
        for (CursorUsage usage : usages) {
            if (usage.getKey().equals(key)) {
                return usage;
            }
        }
        return null;
    }

    public CursorUsage getImplicitCursor() {
        return implicitCursor;
    }

    /** Cursor key of the OPEN/CLOSE/FETCH statement with this ordinal, null if unknown */
    public String getCursorKeyAt(int ordinal) {
        return cursorKeyByStatement.get(ordinal);
    }

    /** Keys of the attribute references of a statement in token order; null entries are unresolved */
    public List<String> getReferenceKeysAt(int ordinal) {
        return referenceKeysByStatement.getOrDefault(ordinal, Collections.emptyList());
    }

    /** Every FETCH and every modifying statement */
    public Set<Integer> getRowCountRefreshOrdinals() {
        return rowCountRefreshOrdinals;
    }

    public boolean refreshesRowCount(int ordinal) {
        return rowCountRefreshOrdinals.contains(ordinal);
    }

    /**
     * Whether the routine reads the shared row count anywhere (explicit or implicit
     * %ROWCOUNT, SQL%FOUND, SQL%NOTFOUND).
     */
    public boolean requiresRowCount() {
        if (implicitCursor.readsRowCount()) {
            return true;
        }
        for (CursorUsage usage : usages) {
            if (usage.readsRowCount()) {
                return true;
            }
        }
        return false;
    }

    /** Package cursors the routine uses; their declarations move into the routine */
    public List<CursorUsage> getHoistedCursors() {
        List<CursorUsage> hoisted = new ArrayList<>();
        for (CursorUsage usage : usages) {
            if (usage.getScope() == CursorScope.PACKAGE && usage.isUsed()) {
                hoisted.add(usage);
            }
        }
        return hoisted;
    }

    /** Explicit cursors whose shadow variables belong to the given block */
    public List<CursorUsage> getUsagesDeclaredIn(int blockId) {
        List<CursorUsage> declared = new ArrayList<>();
        for (CursorUsage usage : usages) {
            if (usage.getDeclaringBlockId() == blockId) {
                declared.add(usage);
            }
        }
        return declared;
    }

    public List<AttributeReferenceSite> getUnresolvedReferences() {
        return unresolvedReferences;
    }

    public int getResolvedReferenceCount() {
        int count = implicitCursor.getReferences().size();
        for (CursorUsage usage : usages) {
            count += usage.getReferences().size();
        }
        return count;
    }

    /** Folded identifiers appearing anywhere in the routine, for shadow name collision checks */
    public Set<String> getRoutineIdentifiers() {
        return routineIdentifiers;
    }

    /**
     * Folded names the routine declares itself: routine name, parameters and the
     * declarations of every block. A hoisted package cursor must not reuse one of them.
     */
    public Set<String> getDeclaredNames() {
        return declaredNames;
    }

    @Override
    public String toString() {
        return "CursorAnalysis{" + routineName + ", usages=" + usages.size()
                + ", resolved=" + getResolvedReferenceCount()
                + ", unresolved=" + unresolvedReferences.size() + "}";
    }
}
