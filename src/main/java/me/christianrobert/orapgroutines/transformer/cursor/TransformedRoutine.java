package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.RoutineSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A routine after attribute rewriting: the original signature, the rewritten body and
 * what the rewrite did.
 */
public class TransformedRoutine {

    private final RoutineDefinition original;
    private final PlSqlBlock body;
    private final ShadowState shadowState;
    private final int rewrittenReferenceCount;
    private final int injectedStatementCount;
    private final List<AttributeReferenceSite> unresolvedReferences;

    public TransformedRoutine(RoutineDefinition original, PlSqlBlock body, ShadowState shadowState,
                              int rewrittenReferenceCount, int injectedStatementCount,
                              List<AttributeReferenceSite> unresolvedReferences) {
        this.original = original;
        this.body = body;
        this.shadowState = shadowState;
        this.rewrittenReferenceCount = rewrittenReferenceCount;
        this.injectedStatementCount = injectedStatementCount;
        this.unresolvedReferences = Collections.unmodifiableList(new ArrayList<>(unresolvedReferences));
    }

    public RoutineDefinition getOriginal() {
        return original;
    }

    public RoutineSignature getSignature() {
        return original.getSignature();
    }

    public String getName() {
        return original.getName();
    }

    public PlSqlBlock getBody() {
        return body;
    }

    public ShadowState getShadowState() {
        return shadowState;
    }

    public int getRewrittenReferenceCount() {
        return rewrittenReferenceCount;
    }

    public int getInjectedStatementCount() {
        return injectedStatementCount;
    }

    public List<AttributeReferenceSite> getUnresolvedReferences() {
        return unresolvedReferences;
    }

    public int getUnresolvedReferenceCount() {
        return unresolvedReferences.size();
    }
}
