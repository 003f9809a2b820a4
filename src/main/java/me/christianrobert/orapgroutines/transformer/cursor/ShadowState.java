package me.christianrobert.orapgroutines.transformer.cursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shadow variable names allocated for one routine.
 *
 * <p>Open and found flags are keyed by cursor key (see {@link CursorUsage#getKey()});
 * the row count variable is shared by the whole routine. Hoisted package cursors
 * also get the name they are declared under inside the routine.
 */
public class ShadowState {

    private final Map<String, String> openFlags;
    private final Map<String, String> foundFlags;
    private final String rowCountName;
    private final Map<String, String> hoistedCursorNames;

    ShadowState(Map<String, String> openFlags, Map<String, String> foundFlags, String rowCountName,
                Map<String, String> hoistedCursorNames) {
        this.openFlags = Collections.unmodifiableMap(new LinkedHashMap<>(openFlags));
        this.foundFlags = Collections.unmodifiableMap(new LinkedHashMap<>(foundFlags));
        this.rowCountName = rowCountName;
        this.hoistedCursorNames = Collections.unmodifiableMap(new LinkedHashMap<>(hoistedCursorNames));
    }

    /** Name of the is-open flag, null if the cursor's %ISOPEN is never queried */
    public String getOpenFlag(String cursorKey) {
        return openFlags.get(cursorKey);
    }

    /** Name of the fetch-outcome flag, null if %FOUND/%NOTFOUND is never queried */
    public String getFoundFlag(String cursorKey) {
        return foundFlags.get(cursorKey);
    }

    /** Name of the shared row count variable, null if no row count is read */
    public String getRowCountName() {
        return rowCountName;
    }

    /** Name of a hoisted package cursor inside the routine, null for other cursors */
    public String getHoistedCursorName(String cursorKey) {
        return hoistedCursorNames.get(cursorKey);
    }

    public boolean tracksRowCount() {
        return rowCountName != null;
    }

    public boolean isEmpty() {
        return openFlags.isEmpty() && foundFlags.isEmpty() && rowCountName == null;
    }

    /** All allocated shadow variable names in allocation order (hoisted cursor names excluded) */
    public List<String> getAllocatedNames() {
        List<String> names = new ArrayList<>();
        if (rowCountName != null) {
            names.add(rowCountName);
        }
        names.addAll(openFlags.values());
        names.addAll(foundFlags.values());
        return names;
    }

    @Override
    public String toString() {
        return "ShadowState{open=" + openFlags + ", found=" + foundFlags + ", rowCount=" + rowCountName
                + ", hoisted=" + hoistedCursorNames + "}";
    }
}
