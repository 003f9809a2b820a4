package me.christianrobert.orapgroutines.transformer.cursor;

import me.christianrobert.orapgroutines.core.tools.NameNormalizer;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.Declaration;
import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.RoutineParameter;
import me.christianrobert.orapgroutines.transformer.model.statement.BlockStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.CloseStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.FetchStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.ModifyingStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OpenStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OtherStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.PlSqlStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.StatementVisitor;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds explicit cursors of a routine and where their state is written and read.
 *
 * <p>Cursor names resolve like PL/SQL scoping: the innermost enclosing block declaring
 * the name wins, then the routine's own declarations, then cursors declared at package
 * body level. A package-qualified name ({@code emp_pkg.c1}) only resolves against the
 * package cursors, and only when the qualifier names the routine's own package.
 *
 * <p>Attribute references inside declarations (default expressions, cursor queries)
 * are not analyzed.
 */
public class CursorStateAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CursorStateAnalyzer.class);

    /**
     * Analyzes a standalone routine (no package cursors).
     */
    public CursorAnalysis analyze(RoutineDefinition routine) {
        return analyze(routine, null, Collections.emptyList());
    }

    /**
     * Analyzes a package routine.
     *
     * @param routine        routine with its body
     * @param packageName    owning package name (may be schema-qualified), null for none
     * @param packageCursors cursors declared at package body level
     */
    public CursorAnalysis analyze(RoutineDefinition routine, String packageName,
                                  List<CursorDeclaration> packageCursors) {
        Walk walk = new Walk(routine, packageName, packageCursors);
        walk.visitBlock(routine.getBody());
        CursorAnalysis analysis = walk.toAnalysis();

        log.debug("Analyzed {}: {}", routine.getName(), analysis);
        for (AttributeReferenceSite site : analysis.getUnresolvedReferences()) {
            log.warn("Unresolved attribute reference {}%{} in routine {} (statement {})",
                    site.getCursorName(), site.getAttribute(), routine.getName(), site.getStatementOrdinal());
        }
        return analysis;
    }

    /**
     * State of one analysis run; a fresh instance per routine.
     */
    private static final class Walk implements StatementVisitor<Void> {

        private final RoutineDefinition routine;
        private final String foldedPackageName;
        private final Map<String, CursorUsage> packageCursorsByName = new LinkedHashMap<>();

        private final Deque<Map<String, CursorUsage>> scopes = new ArrayDeque<>();
        private final List<CursorUsage> localUsages = new ArrayList<>();
        private final CursorUsage implicitCursor = CursorUsage.implicitCursor(PlSqlBlock.ROOT_BLOCK_ID);

        private final Map<Integer, String> cursorKeyByStatement = new HashMap<>();
        private final Map<Integer, List<String>> referenceKeysByStatement = new HashMap<>();
        private final Set<Integer> rowCountRefreshOrdinals = new TreeSet<>();
        private final List<AttributeReferenceSite> unresolved = new ArrayList<>();
        private final Set<String> identifiers = new HashSet<>();
        private final Set<String> declaredNames = new HashSet<>();

        Walk(RoutineDefinition routine, String packageName, List<CursorDeclaration> packageCursors) {
            this.routine = routine;
            this.foldedPackageName = packageName == null ? null : NameNormalizer.normalizeQualifiedName(packageName);
            for (CursorDeclaration declaration : packageCursors) {
                packageCursorsByName.put(declaration.getFoldedName(), new CursorUsage(
                        "package." + declaration.getFoldedName(), declaration.getName(), declaration,
                        CursorScope.PACKAGE, PlSqlBlock.ROOT_BLOCK_ID));
            }

            addDeclaredName(routine.getName());
            for (RoutineParameter parameter : routine.getSignature().getParameters()) {
                addDeclaredName(parameter.getName());
            }
        }

        void visitBlock(PlSqlBlock block) {
            Map<String, CursorUsage> declared = new LinkedHashMap<>();
            for (Declaration declaration : block.getDeclarations()) {
                addDeclaredName(declaration.getName());
                collectIdentifiers(declaration.getTokens());
                if (declaration instanceof CursorDeclaration) {
                    CursorDeclaration cursor = (CursorDeclaration) declaration;
                    CursorUsage usage = new CursorUsage(
                            "block" + block.getBlockId() + "." + cursor.getFoldedName(),
                            cursor.getName(), cursor,
                            block.isRoot() ? CursorScope.ROUTINE : CursorScope.NESTED_BLOCK,
                            block.getBlockId());
                    declared.put(cursor.getFoldedName(), usage);
                    localUsages.add(usage);
                }
            }

            scopes.push(declared);
            for (PlSqlStatement statement : block.getStatements()) {
                statement.accept(this);
            }
            scopes.pop();
        }

        @Override
        public Void visitOpen(OpenStatement statement) {
            CursorUsage usage = resolve(statement.getCursorName());
            if (usage != null) {
                usage.addOpen(statement.getOrdinal());
                cursorKeyByStatement.put(statement.getOrdinal(), usage.getKey());
            } else {
                log.trace("OPEN of {} is not an explicit cursor (cursor variable?)", statement.getCursorName());
            }
            scanReferences(statement);
            return null;
        }

        @Override
        public Void visitClose(CloseStatement statement) {
            CursorUsage usage = resolve(statement.getCursorName());
            if (usage != null) {
                usage.addClose(statement.getOrdinal());
                cursorKeyByStatement.put(statement.getOrdinal(), usage.getKey());
            }
            scanReferences(statement);
            return null;
        }

        @Override
        public Void visitFetch(FetchStatement statement) {
            CursorUsage usage = resolve(statement.getCursorName());
            if (usage != null) {
                usage.addFetch(statement.getOrdinal());
                cursorKeyByStatement.put(statement.getOrdinal(), usage.getKey());
            }
            rowCountRefreshOrdinals.add(statement.getOrdinal());
            scanReferences(statement);
            return null;
        }

        @Override
        public Void visitModifying(ModifyingStatement statement) {
            rowCountRefreshOrdinals.add(statement.getOrdinal());
            scanReferences(statement);
            return null;
        }

        @Override
        public Void visitOther(OtherStatement statement) {
            scanReferences(statement);
            return null;
        }

        @Override
        public Void visitBlock(BlockStatement statement) {
            visitBlock(statement.getBlock());
            return null;
        }

        private void scanReferences(PlSqlStatement statement) {
            collectIdentifiers(statement.getTokens());

            List<String> keys = new ArrayList<>();
            for (SqlToken token : statement.getTokens()) {
                if (!token.isAttributeReference()) {
                    continue;
                }
                AttributeReferenceSite site = new AttributeReferenceSite(
                        statement.getOrdinal(), token.getCursorName(), token.getAttribute());

                if (isImplicitCursor(token.getCursorName())) {
                    implicitCursor.addReference(site);
                    keys.add(implicitCursor.getKey());
                    continue;
                }

                CursorUsage usage = resolve(token.getCursorName());
                if (usage != null) {
                    usage.addReference(site);
                    keys.add(usage.getKey());
                } else {
                    unresolved.add(site);
                    keys.add(null);
                }
            }
            if (!keys.isEmpty()) {
                referenceKeysByStatement.put(statement.getOrdinal(), keys);
            }
        }

        private static boolean isImplicitCursor(String name) {
            return NameNormalizer.sameIdentifier(name, CursorUsage.IMPLICIT_CURSOR_KEY);
        }

        private CursorUsage resolve(String writtenName) {
            String folded = NameNormalizer.normalizeQualifiedName(writtenName);
            int dot = folded.lastIndexOf('.');
            if (dot > 0) {
                String qualifier = folded.substring(0, dot);
                String simpleName = folded.substring(dot + 1);
                return isOwnPackage(qualifier) ? packageCursorsByName.get(simpleName) : null;
            }

            for (Map<String, CursorUsage> scope : scopes) {
                CursorUsage usage = scope.get(folded);
                if (usage != null) {
                    return usage;
                }
            }
            return packageCursorsByName.get(folded);
        }

        private boolean isOwnPackage(String qualifier) {
            if (foldedPackageName == null) {
                return false;
            }
            if (qualifier.equals(foldedPackageName)) {
                return true;
            }
            // "schema.pkg" written while the package was given without schema, or the reverse
            return foldedPackageName.endsWith("." + qualifier) || qualifier.endsWith("." + foldedPackageName);
        }

        private void collectIdentifiers(List<SqlToken> tokens) {
            for (SqlToken token : tokens) {
                if (token.getType() == SqlTokenType.WORD) {
                    for (String part : token.getText().split("[.%]")) {
                        addIdentifier(part);
                    }
                } else if (token.isAttributeReference()) {
                    for (String part : token.getCursorName().split("\\.")) {
                        addIdentifier(part);
                    }
                }
            }
        }

        private void addDeclaredName(String name) {
            if (name != null && !name.isBlank()) {
                declaredNames.add(NameNormalizer.normalizeIdentifier(name));
                addIdentifier(name);
            }
        }

        private void addIdentifier(String identifier) {
            if (identifier != null && !identifier.isBlank()) {
                identifiers.add(NameNormalizer.normalizeIdentifier(identifier));
            }
        }

        CursorAnalysis toAnalysis() {
            List<CursorUsage> usages = new ArrayList<>(localUsages);
            for (CursorUsage packageCursor : packageCursorsByName.values()) {
                if (packageCursor.isUsed()) {
                    usages.add(packageCursor);
                    addIdentifier(packageCursor.getName());
                    collectIdentifiers(packageCursor.getDeclaration().getTokens());
                }
            }
            return new CursorAnalysis(routine.getName(), usages, implicitCursor,
                    cursorKeyByStatement, referenceKeysByStatement, rowCountRefreshOrdinals,
                    unresolved, identifiers, declaredNames);
        }
    }
}
