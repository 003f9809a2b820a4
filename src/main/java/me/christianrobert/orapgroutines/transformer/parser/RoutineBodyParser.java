package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.context.TransformationException;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.Declaration;
import me.christianrobert.orapgroutines.transformer.model.OtherDeclaration;
import me.christianrobert.orapgroutines.transformer.model.ParameterMode;
import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.RoutineKind;
import me.christianrobert.orapgroutines.transformer.model.RoutineParameter;
import me.christianrobert.orapgroutines.transformer.model.RoutineSignature;
import me.christianrobert.orapgroutines.transformer.model.VariableDeclaration;
import me.christianrobert.orapgroutines.transformer.model.statement.BlockStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.CloseStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.ControlRole;
import me.christianrobert.orapgroutines.transformer.model.statement.FetchStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.ModificationKind;
import me.christianrobert.orapgroutines.transformer.model.statement.ModifyingStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OpenStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.OtherStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.PlSqlStatement;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokenType;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses a routine segment (FUNCTION/PROCEDURE keyword through the final ';') into
 * its signature and body block.
 *
 * <p>Statements are split at ';' and at control headers, which become their own
 * {@link OtherStatement}s with a {@link ControlRole}. Every source statement gets the
 * next ordinal in source order, nested blocks included; blocks get ids in pre-order
 * with the routine body as block 0.
 *
 * <p>Not thread-safe. Use one instance per routine or parse sequentially.
 */
public class RoutineBodyParser {

    private static final Logger log = LoggerFactory.getLogger(RoutineBodyParser.class);

    private static final Set<String> ROUTINE_MODIFIERS = Set.of(
            "DETERMINISTIC", "PIPELINED", "PARALLEL_ENABLE", "RESULT_CACHE",
            "AUTHID", "ACCESSIBLE", "AGGREGATE", "SQL_MACRO");

    private int nextOrdinal;
    private int nextBlockId;
    private String routineName;

    /**
     * Parses a complete routine definition.
     *
     * @param segmentTokens tokens from FUNCTION/PROCEDURE through the final ';'
     * @throws TransformationException for unsupported or malformed constructs
     */
    public RoutineDefinition parseRoutine(List<SqlToken> segmentTokens) {
        this.nextOrdinal = 0;
        this.nextBlockId = PlSqlBlock.ROOT_BLOCK_ID;
        this.routineName = null;

        TokenReader reader = new TokenReader(segmentTokens);
        RoutineSignature signature = readSignature(reader);
        this.routineName = signature.getName();

        if (!reader.peekWord("IS", "AS")) {
            throw new TransformationException("Routine has no body (expected IS or AS)",
                    SqlToken.join(segmentTokens), "routine " + routineName);
        }
        reader.next();

        PlSqlBlock body = readBlock(reader, true);
        log.debug("Parsed routine {}: {} statements in {} blocks",
                routineName, nextOrdinal, nextBlockId);
        return new RoutineDefinition(signature, body);
    }

    /**
     * Parses a routine declaration (spec entry) or the signature part of a definition.
     */
    public RoutineSignature parseSignature(List<SqlToken> segmentTokens) {
        return readSignature(new TokenReader(segmentTokens));
    }

    /**
     * Parses a single declaration ending with ';' (block or package level).
     */
    public Declaration parseDeclaration(List<SqlToken> declarationTokens) {
        List<SqlToken> trimmed = SqlTokens.trim(declarationTokens);
        List<SqlToken> significant = SqlTokens.significant(trimmed);
        if (significant.isEmpty()) {
            throw new TransformationException("Empty declaration");
        }

        SqlToken first = significant.get(0);
        if (first.isWord("FUNCTION") || first.isWord("PROCEDURE")) {
            throw new TransformationException("Nested subprograms are not supported",
                    SqlToken.join(trimmed), context());
        }
        if (first.isWord("CURSOR")) {
            return parseCursorDeclaration(trimmed);
        }
        if (first.isWord("TYPE") || first.isWord("SUBTYPE")) {
            return new OtherDeclaration(significant.size() > 1 ? significant.get(1).getText() : null, trimmed);
        }
        if (first.isWord("PRAGMA")) {
            return new OtherDeclaration(null, trimmed);
        }
        if (significant.size() > 1 && significant.get(1).isWord("EXCEPTION")) {
            return new OtherDeclaration(first.getText(), trimmed);
        }
        return parseVariableDeclaration(trimmed);
    }

    // ========== Signature ==========

    private RoutineSignature readSignature(TokenReader reader) {
        SqlToken keyword = reader.next();
        if (keyword == null || !(keyword.isWord("FUNCTION") || keyword.isWord("PROCEDURE"))) {
            throw new TransformationException("Expected FUNCTION or PROCEDURE",
                    keyword != null ? keyword.getText() : "", context());
        }
        RoutineKind kind = keyword.isWord("FUNCTION") ? RoutineKind.FUNCTION : RoutineKind.PROCEDURE;

        SqlToken nameToken = reader.next();
        if (nameToken == null) {
            throw new TransformationException("Routine name missing after " + keyword.getText());
        }
        String name = nameToken.getText();

        List<RoutineParameter> parameters = Collections.emptyList();
        if (reader.peekSymbol("(")) {
            parameters = parseParameters(readParenthesized(reader));
        }

        String returnType = null;
        if (reader.peekWord("RETURN")) {
            reader.next();
            reader.skipWhitespace();
            int start = reader.position();
            while (!reader.atEnd() && !reader.peekWord("IS", "AS") && !reader.peekSymbol(";")
                    && !isModifier(reader.peek())) {
                reader.next();
            }
            returnType = SqlToken.join(SqlTokens.trim(reader.slice(start, reader.position())));
        }

        // DETERMINISTIC, RESULT_CACHE (...) and friends carry no meaning for the translation
        while (!reader.atEnd() && !reader.peekWord("IS", "AS") && !reader.peekSymbol(";")) {
            if (reader.peekSymbol("(")) {
                readParenthesized(reader);
            } else {
                reader.next();
            }
        }

        return new RoutineSignature(name, kind, parameters, returnType);
    }

    private static boolean isModifier(SqlToken token) {
        return token != null && token.getType() == SqlTokenType.WORD
                && ROUTINE_MODIFIERS.contains(token.getText().toUpperCase(Locale.ROOT));
    }

    /**
     * Consumes a parenthesized group and returns the tokens between the parentheses.
     */
    private List<SqlToken> readParenthesized(TokenReader reader) {
        reader.next(); // (
        int start = reader.position();
        int depth = 1;
        while (reader.position() < reader.size()) {
            SqlToken token = reader.tokenAt(reader.position());
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
                if (depth == 0) {
                    List<SqlToken> inner = reader.slice(start, reader.position());
                    reader.reset(reader.position() + 1);
                    return inner;
                }
            }
            reader.reset(reader.position() + 1);
        }
        throw new TransformationException("Unbalanced parentheses",
                SqlToken.join(reader.slice(start, reader.size())), context());
    }

    private List<RoutineParameter> parseParameters(List<SqlToken> inner) {
        List<RoutineParameter> parameters = new ArrayList<>();
        for (List<SqlToken> group : splitAtTopLevelCommas(inner)) {
            if (!SqlTokens.significant(group).isEmpty()) {
                parameters.add(parseParameter(group));
            }
        }
        return parameters;
    }

    private RoutineParameter parseParameter(List<SqlToken> group) {
        TokenReader reader = new TokenReader(group);
        String name = reader.next().getText();

        ParameterMode mode = ParameterMode.IN;
        if (reader.peekWord("IN")) {
            reader.next();
            if (reader.peekWord("OUT")) {
                reader.next();
                mode = ParameterMode.IN_OUT;
            }
        } else if (reader.peekWord("OUT")) {
            reader.next();
            mode = ParameterMode.OUT;
        }
        if (reader.peekWord("NOCOPY")) {
            reader.next();
        }

        reader.skipWhitespace();
        int typeStart = reader.position();
        while (!reader.atEnd() && !reader.peekSymbol(":=") && !reader.peekWord("DEFAULT")) {
            reader.next();
        }
        String dataType = SqlToken.join(SqlTokens.trim(reader.slice(typeStart, reader.position())));

        String defaultValue = null;
        if (!reader.atEnd()) {
            reader.next(); // := or DEFAULT
            defaultValue = SqlToken.join(SqlTokens.trim(reader.slice(reader.position(), reader.size())));
        }
        return new RoutineParameter(name, mode, dataType, defaultValue);
    }

    private static List<List<SqlToken>> splitAtTopLevelCommas(List<SqlToken> tokens) {
        List<List<SqlToken>> groups = new ArrayList<>();
        List<SqlToken> current = new ArrayList<>();
        int depth = 0;
        for (SqlToken token : tokens) {
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(",")) {
                groups.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        groups.add(current);
        return groups;
    }

    // ========== Blocks ==========

    /**
     * Reads [declarations] BEGIN statements END [label] ;
     */
    private PlSqlBlock readBlock(TokenReader reader, boolean hasDeclarations) {
        int blockId = nextBlockId++;

        List<Declaration> declarations = hasDeclarations
                ? readDeclarations(reader)
                : Collections.emptyList();

        if (!reader.peekWord("BEGIN")) {
            throw unterminated(reader, "expected BEGIN");
        }
        reader.next();

        List<PlSqlStatement> statements = readStatements(reader);

        reader.next(); // END
        if (reader.peek() != null && !reader.peekSymbol(";")
                && reader.peek().getType() == SqlTokenType.WORD) {
            reader.next(); // label or routine name
        }
        if (reader.peekSymbol(";")) {
            reader.next();
        } else if (blockId != PlSqlBlock.ROOT_BLOCK_ID) {
            throw unterminated(reader, "expected ';' after END");
        }

        return new PlSqlBlock(blockId, declarations, statements);
    }

    private List<Declaration> readDeclarations(TokenReader reader) {
        List<Declaration> declarations = new ArrayList<>();
        while (true) {
            SqlToken next = reader.peek();
            if (next == null) {
                throw unterminated(reader, "expected BEGIN");
            }
            if (next.isWord("BEGIN")) {
                return declarations;
            }
            declarations.add(parseDeclaration(readUntilSemicolon(reader)));
        }
    }

    private CursorDeclaration parseCursorDeclaration(List<SqlToken> tokens) {
        TokenReader reader = new TokenReader(tokens);
        reader.next(); // CURSOR
        SqlToken name = reader.next();
        if (name == null) {
            throw new TransformationException("Cursor name missing", SqlToken.join(tokens), context());
        }

        List<RoutineParameter> parameters = Collections.emptyList();
        if (reader.peekSymbol("(")) {
            parameters = parseParameters(readParenthesized(reader));
        }
        while (!reader.atEnd() && !reader.peekWord("IS")) {
            reader.next(); // RETURN rowtype
        }
        if (reader.atEnd()) {
            throw new TransformationException("Cursor declaration without query",
                    SqlToken.join(tokens), context());
        }
        reader.next(); // IS

        int queryStart = reader.position();
        int queryEnd = tokens.size();
        if (tokens.get(queryEnd - 1).isSymbol(";")) {
            queryEnd--;
        }
        List<SqlToken> query = SqlTokens.trim(reader.slice(queryStart, queryEnd));
        return new CursorDeclaration(name.getText(), parameters, query, tokens);
    }

    private VariableDeclaration parseVariableDeclaration(List<SqlToken> tokens) {
        TokenReader reader = new TokenReader(tokens);
        String name = reader.next().getText();

        boolean constant = false;
        if (reader.peekWord("CONSTANT")) {
            reader.next();
            constant = true;
        }

        reader.skipWhitespace();
        int typeStart = reader.position();
        int depth = 0;
        while (!reader.atEnd() && !reader.peekSymbol(";")) {
            if (depth == 0 && (reader.peekSymbol(":=") || reader.peekWord("DEFAULT")
                    || (reader.peekWord("NOT") && reader.peek(1) != null && reader.peek(1).isWord("NULL")))) {
                break;
            }
            SqlToken token = reader.next();
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            }
        }
        String dataType = SqlToken.join(SqlTokens.trim(reader.slice(typeStart, reader.position())));

        boolean notNull = false;
        if (reader.peekWord("NOT")) {
            reader.next();
            reader.next();
            notNull = true;
        }

        List<SqlToken> defaultTokens = Collections.emptyList();
        if (reader.peekSymbol(":=") || reader.peekWord("DEFAULT")) {
            reader.next();
            int end = tokens.size();
            if (tokens.get(end - 1).isSymbol(";")) {
                end--;
            }
            defaultTokens = SqlTokens.trim(reader.slice(reader.position(), end));
        }

        return new VariableDeclaration(name, constant, dataType, notNull, defaultTokens, tokens);
    }

    // ========== Statements ==========

    /**
     * Reads statements up to (not including) the END that closes the current block.
     */
    private List<PlSqlStatement> readStatements(TokenReader reader) {
        List<PlSqlStatement> statements = new ArrayList<>();
        boolean inExceptionSection = false;
        int caseDepth = 0;

        while (true) {
            SqlToken next = reader.peek();
            if (next == null) {
                throw unterminated(reader, "missing END");
            }

            if (next.isWord("END")) {
                SqlToken following = reader.peek(1);
                if (following != null && (following.isWord("IF") || following.isWord("LOOP") || following.isWord("CASE"))) {
                    if (following.isWord("CASE")) {
                        caseDepth--;
                    }
                    statements.add(other(readUntilSemicolon(reader), ControlRole.CLOSES));
                    continue;
                }
                return statements;
            }

            if (next.isWord("DECLARE")) {
                int ordinal = nextOrdinal++;
                reader.next();
                statements.add(new BlockStatement(ordinal, readBlock(reader, true)));
            } else if (next.isWord("BEGIN")) {
                int ordinal = nextOrdinal++;
                statements.add(new BlockStatement(ordinal, readBlock(reader, false)));
            } else if (next.isSymbol("<<")) {
                statements.add(other(readThrough(reader, ">>", true, true), ControlRole.LABEL));
            } else if (next.isWord("IF")) {
                statements.add(other(readThrough(reader, "THEN", true, false), ControlRole.OPENS));
            } else if (next.isWord("ELSIF")) {
                statements.add(other(readThrough(reader, "THEN", true, false), ControlRole.CONTINUES));
            } else if (next.isWord("ELSE")) {
                statements.add(other(readSingle(reader), ControlRole.CONTINUES));
            } else if (next.isWord("WHILE") || next.isWord("FOR")) {
                statements.add(other(readThrough(reader, "LOOP", true, false), ControlRole.OPENS));
            } else if (next.isWord("LOOP")) {
                statements.add(other(readSingle(reader), ControlRole.OPENS));
            } else if (next.isWord("CASE")) {
                caseDepth++;
                statements.add(other(readThrough(reader, "WHEN", false, false), ControlRole.OPENS));
            } else if (next.isWord("WHEN")) {
                ControlRole role = inExceptionSection && caseDepth == 0 ? ControlRole.HANDLER : ControlRole.CONTINUES;
                statements.add(other(readThrough(reader, "THEN", true, false), role));
            } else if (next.isWord("EXCEPTION")) {
                inExceptionSection = true;
                statements.add(other(readSingle(reader), ControlRole.EXCEPTION_SECTION));
            } else {
                statements.add(classify(readUntilSemicolon(reader)));
            }
        }
    }

    private PlSqlStatement classify(List<SqlToken> tokens) {
        List<SqlToken> significant = SqlTokens.significant(tokens);
        SqlToken first = significant.get(0);
        int ordinal = nextOrdinal++;

        if (first.isWord("OPEN") && significant.size() > 1) {
            boolean forQuery = containsTopLevelWord(significant.subList(2, significant.size()), "FOR");
            return new OpenStatement(ordinal, tokens, significant.get(1).getText(), forQuery);
        }
        if (first.isWord("CLOSE") && significant.size() > 1) {
            return new CloseStatement(ordinal, tokens, significant.get(1).getText());
        }
        if (first.isWord("FETCH") && significant.size() > 1) {
            if (containsTopLevelWord(significant, "BULK")) {
                throw new TransformationException("BULK COLLECT is not yet supported",
                        SqlToken.join(tokens), context());
            }
            return new FetchStatement(ordinal, tokens, significant.get(1).getText(), fetchTargets(tokens));
        }
        if (first.isWord("INSERT")) {
            return new ModifyingStatement(ordinal, tokens, ModificationKind.INSERT);
        }
        if (first.isWord("UPDATE")) {
            return new ModifyingStatement(ordinal, tokens, ModificationKind.UPDATE);
        }
        if (first.isWord("DELETE")) {
            return new ModifyingStatement(ordinal, tokens, ModificationKind.DELETE);
        }
        if (first.isWord("MERGE")) {
            return new ModifyingStatement(ordinal, tokens, ModificationKind.MERGE);
        }
        if ((first.isWord("SELECT") || first.isWord("WITH")) && containsTopLevelWord(significant, "INTO")) {
            if (containsTopLevelWord(significant, "BULK")) {
                throw new TransformationException("BULK COLLECT is not yet supported",
                        SqlToken.join(tokens), context());
            }
            return new ModifyingStatement(ordinal, tokens, ModificationKind.SELECT_INTO);
        }
        return new OtherStatement(ordinal, tokens, ControlRole.NONE);
    }

    private static List<String> fetchTargets(List<SqlToken> tokens) {
        List<SqlToken> afterInto = new ArrayList<>();
        boolean seenInto = false;
        for (SqlToken token : tokens) {
            if (!seenInto) {
                seenInto = token.isWord("INTO");
                continue;
            }
            if (token.isSymbol(";") || token.isWord("LIMIT")) {
                break;
            }
            afterInto.add(token);
        }
        List<String> targets = new ArrayList<>();
        for (List<SqlToken> group : splitAtTopLevelCommas(afterInto)) {
            String target = SqlToken.join(SqlTokens.trim(group));
            if (!target.isEmpty()) {
                targets.add(target);
            }
        }
        return targets;
    }

    private static boolean containsTopLevelWord(List<SqlToken> tokens, String word) {
        int depth = 0;
        for (SqlToken token : tokens) {
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isWord(word)) {
                return true;
            }
        }
        return false;
    }

    private OtherStatement other(List<SqlToken> tokens, ControlRole role) {
        return new OtherStatement(nextOrdinal++, tokens, role);
    }

    private List<SqlToken> readSingle(TokenReader reader) {
        reader.skipWhitespace();
        int start = reader.position();
        reader.next();
        return reader.slice(start, reader.position());
    }

    /**
     * Reads through the next ';' at parenthesis depth 0.
     */
    private List<SqlToken> readUntilSemicolon(TokenReader reader) {
        reader.skipWhitespace();
        int start = reader.position();
        int depth = 0;
        while (true) {
            SqlToken token = reader.next();
            if (token == null) {
                throw unterminated(reader, "statement without ';'", start);
            }
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(";")) {
                return SqlTokens.trim(reader.slice(start, reader.position()));
            }
        }
    }

    /**
     * Reads a control header up to the terminating keyword, skipping parenthesized
     * groups and CASE ... END expressions.
     *
     * @param inclusive whether the terminator belongs to the header (THEN, LOOP) or to
     *                  the next statement (WHEN after a CASE header)
     */
    private List<SqlToken> readThrough(TokenReader reader, String terminator, boolean inclusive, boolean symbol) {
        reader.skipWhitespace();
        int start = reader.position();
        reader.next(); // header keyword itself
        int parenDepth = 0;
        int caseExpressionDepth = 0;
        while (true) {
            SqlToken token = reader.peek();
            if (token == null) {
                throw unterminated(reader, "expected " + terminator, start);
            }
            boolean matches = symbol ? token.isSymbol(terminator) : token.isWord(terminator);
            if (parenDepth == 0 && caseExpressionDepth == 0 && matches) {
                if (inclusive) {
                    reader.next();
                } else {
                    reader.skipWhitespace();
                }
                return SqlTokens.trim(reader.slice(start, reader.position()));
            }
            reader.next();
            if (token.isSymbol("(")) {
                parenDepth++;
            } else if (token.isSymbol(")")) {
                parenDepth--;
            } else if (token.isWord("CASE")) {
                caseExpressionDepth++;
            } else if (token.isWord("END") && caseExpressionDepth > 0) {
                caseExpressionDepth--;
            }
        }
    }

    private TransformationException unterminated(TokenReader reader, String detail) {
        return unterminated(reader, detail, Math.max(0, reader.position() - 20));
    }

    private TransformationException unterminated(TokenReader reader, String detail, int fromIndex) {
        String fragment = SqlToken.join(reader.slice(Math.min(fromIndex, reader.size()), reader.size()));
        return new TransformationException("Unterminated block: " + detail, fragment.trim(), context());
    }

    private String context() {
        return routineName != null ? "routine " + routineName : null;
    }
}
