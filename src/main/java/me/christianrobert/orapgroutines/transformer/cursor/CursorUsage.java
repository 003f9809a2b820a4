package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.token.CursorAttribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the analyzer found about one cursor within one routine: where it is
 * declared, where its state changes and where its attributes are queried.
 *
 * <p>Filled by {@link CursorStateAnalyzer} while walking the routine, read-only afterwards.
 */
public class CursorUsage {

    public static final String IMPLICIT_CURSOR_KEY = "sql";

    private final String key;
    private final String name;
    private final CursorDeclaration declaration;
    private final CursorScope scope;
    private final int declaringBlockId;

    private final List<Integer> openOrdinals = new ArrayList<>();
    private final List<Integer> closeOrdinals = new ArrayList<>();
    private final List<Integer> fetchOrdinals = new ArrayList<>();
    private final List<AttributeReferenceSite> references = new ArrayList<>();

    CursorUsage(String key, String name, CursorDeclaration declaration, CursorScope scope, int declaringBlockId) {
        this.key = key;
        this.name = name;
        this.declaration = declaration;
        this.scope = scope;
        this.declaringBlockId = declaringBlockId;
    }

    static CursorUsage implicitCursor(int rootBlockId) {
        return new CursorUsage(IMPLICIT_CURSOR_KEY, "SQL", null, CursorScope.IMPLICIT, rootBlockId);
    }

    /**
     * Identity of the cursor within the routine. Two cursors with the same name in
     * different blocks have different keys.
     */
    public String getKey() {
        return key;
    }

    /** Declared name, unqualified */
    public String getName() {
        return name;
    }

    public String getFoldedName() {
        return NameNormalizer.normalizeIdentifier(name);
    }

    /** Null for the implicit SQL cursor */
    public CursorDeclaration getDeclaration() {
        return declaration;
    }

    public CursorScope getScope() {
        return scope;
    }

    /** Block whose declaration section receives the shadow variables */
    public int getDeclaringBlockId() {
        return declaringBlockId;
    }

    public List<Integer> getOpenOrdinals() {
        return Collections.unmodifiableList(openOrdinals);
    }

    public List<Integer> getCloseOrdinals() {
        return Collections.unmodifiableList(closeOrdinals);
    }

    public List<Integer> getFetchOrdinals() {
        return Collections.unmodifiableList(fetchOrdinals);
    }

    public List<AttributeReferenceSite> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public boolean usesAttribute(CursorAttribute attribute) {
        for (AttributeReferenceSite site : references) {
            if (site.getAttribute() == attribute) {
                return true;
            }
        }
        return false;
    }

    /** %ISOPEN is queried, so the routine needs an open flag */
    public boolean needsOpenFlag() {
        return scope != CursorScope.IMPLICIT && usesAttribute(CursorAttribute.ISOPEN);
    }

    /** %FOUND or %NOTFOUND is queried, so the routine needs a fetch-outcome flag */
    public boolean needsFoundFlag() {
        return scope != CursorScope.IMPLICIT
                && (usesAttribute(CursorAttribute.FOUND) || usesAttribute(CursorAttribute.NOTFOUND));
    }

    /**
     * Whether the routine's row count variable is read through this cursor. For the
     * implicit cursor, %FOUND and %NOTFOUND are derived from the row count too.
     */
    public boolean readsRowCount() {
        if (scope == CursorScope.IMPLICIT) {
            return usesAttribute(CursorAttribute.ROWCOUNT)
                    || usesAttribute(CursorAttribute.FOUND)
                    || usesAttribute(CursorAttribute.NOTFOUND);
        }
        return usesAttribute(CursorAttribute.ROWCOUNT);
    }

    /** Any OPEN, CLOSE, FETCH or attribute reference in the routine */
    public boolean isUsed() {
        return !openOrdinals.isEmpty() || !closeOrdinals.isEmpty()
                || !fetchOrdinals.isEmpty() || !references.isEmpty();
    }

    void addOpen(int ordinal) {
        openOrdinals.add(ordinal);
    }

    void addClose(int ordinal) {
        closeOrdinals.add(ordinal);
    }

    void addFetch(int ordinal) {
        fetchOrdinals.add(ordinal);
    }

    void addReference(AttributeReferenceSite site) {
        references.add(site);
    }

    @Override
    public String toString() {
        return "CursorUsage{" + key + ", scope=" + scope
                + ", opens=" + openOrdinals + ", closes=" + closeOrdinals
                + ", fetches=" + fetchOrdinals + ", references=" + references + "}";
    }
}
