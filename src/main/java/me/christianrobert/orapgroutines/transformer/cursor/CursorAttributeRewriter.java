package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.Declaration;
import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.VariableDeclaration;
import me.christianrobert.orapgroutines.transformer.model.statement.BlockStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.CloseStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.FetchStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.ModifyingStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OpenStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OtherStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.PlSqlStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.StatementVisitor;
import me.christianrobert.orapgroutines.transformer.model.token.CursorAttribute;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a routine body so cursor attributes read shadow variables instead of Oracle
 * cursor state.
 *
 * <p>One traversal over the original body builds the new one. Per block it
 * <ol>
 *   <li>adds shadow declarations for the cursors declared in that block (the root
 *       block also receives hoisted package cursors and the shared row count),</li>
 *   <li>inserts state transitions right after OPEN, CLOSE, FETCH and modifying statements,</li>
 *   <li>substitutes resolved attribute references.</li>
 * </ol>
 * OPEN, FETCH and CLOSE of a hoisted package cursor name the cursor as it is declared
 * inside the routine, without package qualifier.
 * The original is never mutated, and positions come from the analysis as ordinals of
 * the original statements, so insertions cannot shift them.
 */
public class CursorAttributeRewriter {

    private static final Logger log = LoggerFactory.getLogger(CursorAttributeRewriter.class);

    public TransformedRoutine rewrite(RoutineDefinition routine, CursorAnalysis analysis) {
        ShadowState shadowState = new ShadowNameAllocator(analysis.getRoutineIdentifiers()).allocate(analysis);
        RewritePass pass = new RewritePass(analysis, shadowState);
        PlSqlBlock body = pass.rewriteBlock(routine.getBody());

        log.debug("Rewrote {}: {} references substituted, {} statements injected, {} unresolved, {}",
                routine.getName(), pass.rewrittenReferences, pass.injectedStatements,
                analysis.getUnresolvedReferences().size(), shadowState);

        return new TransformedRoutine(routine, body, shadowState,
                pass.rewrittenReferences, pass.injectedStatements, analysis.getUnresolvedReferences());
    }

    private static final class RewritePass implements StatementVisitor<List<PlSqlStatement>> {

        private final CursorAnalysis analysis;
        private final ShadowState shadowState;
        private int rewrittenReferences;
        private int injectedStatements;

        RewritePass(CursorAnalysis analysis, ShadowState shadowState) {
            this.analysis = analysis;
            this.shadowState = shadowState;
        }

        PlSqlBlock rewriteBlock(PlSqlBlock block) {
            List<Declaration> declarations = new ArrayList<>();
            if (block.isRoot()) {
                for (CursorUsage hoisted : analysis.getHoistedCursors()) {
                    declarations.add(hoistedDeclaration(hoisted));
                }
            }
            declarations.addAll(block.getDeclarations());
            declarations.addAll(shadowDeclarations(block));

            List<PlSqlStatement> statements = new ArrayList<>();
            for (PlSqlStatement statement : block.getStatements()) {
                statements.addAll(statement.accept(this));
            }
            return new PlSqlBlock(block.getBlockId(), declarations, statements);
        }

        private CursorDeclaration hoistedDeclaration(CursorUsage hoisted) {
            CursorDeclaration declaration = hoisted.getDeclaration();
            String name = shadowState.getHoistedCursorName(hoisted.getKey());
            if (name == null || name.equals(declaration.getFoldedName())) {
                return declaration;
            }
            return declaration.withName(name);
        }

        private List<Declaration> shadowDeclarations(PlSqlBlock block) {
            List<Declaration> shadows = new ArrayList<>();
            if (block.isRoot() && shadowState.tracksRowCount()) {
                shadows.add(VariableDeclaration.synthesized(shadowState.getRowCountName(), "INTEGER", "0"));
            }
            for (CursorUsage usage : analysis.getUsagesDeclaredIn(block.getBlockId())) {
                String openFlag = shadowState.getOpenFlag(usage.getKey());
                if (openFlag != null) {
                    shadows.add(VariableDeclaration.synthesized(openFlag, "BOOLEAN", "FALSE"));
                }
                String foundFlag = shadowState.getFoundFlag(usage.getKey());
                if (foundFlag != null) {
                    shadows.add(VariableDeclaration.synthesized(foundFlag, "BOOLEAN", null));
                }
            }
            return shadows;
        }

        @Override
        public List<PlSqlStatement> visitOpen(OpenStatement statement) {
            List<PlSqlStatement> result = single(renameHoistedCursor(substitute(statement)));
            String openFlag = openFlagOf(statement);
            if (openFlag != null) {
                inject(result, openFlag + " := TRUE;");
            }
            return result;
        }

        @Override
        public List<PlSqlStatement> visitClose(CloseStatement statement) {
            List<PlSqlStatement> result = single(renameHoistedCursor(substitute(statement)));
            String openFlag = openFlagOf(statement);
            if (openFlag != null) {
                inject(result, openFlag + " := FALSE;");
            }
            return result;
        }

        @Override
        public List<PlSqlStatement> visitFetch(FetchStatement statement) {
            List<PlSqlStatement> result = single(renameHoistedCursor(substitute(statement)));
            injectRowCountRefresh(result, statement);
            String key = analysis.getCursorKeyAt(statement.getOrdinal());
            String foundFlag = key == null ? null : shadowState.getFoundFlag(key);
            if (foundFlag != null) {
                inject(result, foundFlag + " := FOUND;");
            }
            return result;
        }

        @Override
        public List<PlSqlStatement> visitModifying(ModifyingStatement statement) {
            List<PlSqlStatement> result = single(substitute(statement));
            injectRowCountRefresh(result, statement);
            return result;
        }

        @Override
        public List<PlSqlStatement> visitOther(OtherStatement statement) {
            return single(substitute(statement));
        }

        @Override
        public List<PlSqlStatement> visitBlock(BlockStatement statement) {
            return single(statement.withBlock(rewriteBlock(statement.getBlock())));
        }

        private String openFlagOf(PlSqlStatement statement) {
            String key = analysis.getCursorKeyAt(statement.getOrdinal());
            return key == null ? null : shadowState.getOpenFlag(key);
        }

        /**
         * Replaces the cursor name (second significant token) of an OPEN, FETCH or CLOSE
         * on a hoisted package cursor when it is written differently from the hoisted name.
         */
        private PlSqlStatement renameHoistedCursor(PlSqlStatement statement) {
            String key = analysis.getCursorKeyAt(statement.getOrdinal());
            String name = key == null ? null : shadowState.getHoistedCursorName(key);
            if (name == null) {
                return statement;
            }

            List<SqlToken> tokens = new ArrayList<>(statement.getTokens());
            int significant = 0;
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).isWhitespace() || ++significant < 2) {
                    continue;
                }
                if (NameNormalizer.normalizeQualifiedName(tokens.get(i).getText()).equals(name)) {
                    return statement;
                }
                tokens.set(i, SqlToken.of(SqlTokenType.WORD, name));
                return statement.withTokens(tokens);
            }
            return statement;
        }

        private void injectRowCountRefresh(List<PlSqlStatement> result, PlSqlStatement statement) {
            if (shadowState.tracksRowCount() && analysis.refreshesRowCount(statement.getOrdinal())) {
                inject(result, "GET DIAGNOSTICS " + shadowState.getRowCountName() + " = ROW_COUNT;");
            }
        }

        private void inject(List<PlSqlStatement> result, String code) {
            result.add(OtherStatement.synthesized(code));
            injectedStatements++;
        }

        private static List<PlSqlStatement> single(PlSqlStatement statement) {
            List<PlSqlStatement> result = new ArrayList<>();
            result.add(statement);
            return result;
        }

        private PlSqlStatement substitute(PlSqlStatement statement) {
            List<String> keys = analysis.getReferenceKeysAt(statement.getOrdinal());
            if (keys.isEmpty()) {
                return statement;
            }

            List<SqlToken> tokens = new ArrayList<>(statement.getTokens().size());
            int referenceIndex = 0;
            for (SqlToken token : statement.getTokens()) {
                if (!token.isAttributeReference()) {
                    tokens.add(token);
                    continue;
                }
                String key = keys.get(referenceIndex++);
                String replacement = key == null ? null : replacementFor(key, token.getAttribute());
                if (replacement == null) {
                    tokens.add(token);
                } else {
                    tokens.add(SqlToken.of(SqlTokenType.WORD, replacement));
                    rewrittenReferences++;
                }
            }
            return statement.withTokens(tokens);
        }

        private String replacementFor(String key, CursorAttribute attribute) {
            String rowCount = shadowState.getRowCountName();
            if (CursorUsage.IMPLICIT_CURSOR_KEY.equals(key)) {
                switch (attribute) {
                    case ISOPEN:
                        // the implicit cursor is always closed after its statement
                        return "FALSE";
                    case FOUND:
                        return "(" + rowCount + " > 0)";
                    case NOTFOUND:
                        return "(" + rowCount + " = 0)";
                    case ROWCOUNT:
                        return rowCount;
                    default:
                        return null;
                }
            }
            switch (attribute) {
                case ISOPEN:
                    return shadowState.getOpenFlag(key);
                case FOUND:
                    return shadowState.getFoundFlag(key);
                case NOTFOUND:
                    return "(NOT " + shadowState.getFoundFlag(key) + ")";
                case ROWCOUNT:
                    return rowCount;
                default:
                    return null;
            }
        }
    }
}
