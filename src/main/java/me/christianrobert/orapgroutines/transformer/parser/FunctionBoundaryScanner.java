package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Lightweight state machine scanner for identifying function/procedure boundaries in Oracle packages.
 *
 * Works on tokens, so string literals never produce false keyword matches. A routine body
 * ends at the END that closes its own BEGIN; nested subprograms in its declaration section
 * are skipped as a whole (the body parser rejects them later, per routine).
 *
 * **Usage:**
 * ```java
 * String cleanedBody = CodeCleaner.removeComments(packageBodySql);
 * FunctionBoundaryScanner scanner = new FunctionBoundaryScanner();
 * PackageSegments segments = scanner.scanPackageBody(cleanedBody);
 * ```
 *
 * **IMPORTANT:** Input MUST be comment-free (use CodeCleaner.removeComments first).
 */
public class FunctionBoundaryScanner {

    private static final Logger log = LoggerFactory.getLogger(FunctionBoundaryScanner.class);

    /**
     * Scanner states.
     */
    private enum State {
        HEADER,               // Before IS/AS of CREATE PACKAGE [BODY]
        PACKAGE_LEVEL,        // Looking for routines and package-level declarations
        IN_SIGNATURE,         // Between FUNCTION/PROCEDURE keyword and IS/AS or ';'
        IN_FUNCTION_BODY,     // Inside routine implementation
        DONE                  // Package END or initialization section reached
    }

    private final SqlTokenizer tokenizer = new SqlTokenizer();

    private State currentState;
    private List<SqlToken> tokens;
    private int position;

    // Current routine
    private String currentFunctionName;
    private int currentFunctionStart;
    private boolean currentIsFunction;
    private int parenDepth;

    // Body tracking: open BEGIN/CASE keywords, nested subprograms awaiting their END
    private final Deque<String> openers = new ArrayDeque<>();
    private int pendingNestedSubprograms;

    private PackageSegments segments;

    /**
     * Scans a package body and identifies routine definitions (forward declarations
     * are reported as segments without body).
     *
     * @param packageBodySql Clean package body SQL (comments removed)
     * @return Scanned segments with function boundaries
     */
    public PackageSegments scanPackageBody(String packageBodySql) {
        log.debug("Scanning package body ({} chars)", packageBodySql.length());
        scan(packageBodySql);
        log.debug("Body scan complete: found {} routines, {} package-level declarations",
                segments.getFunctionCount(), segments.getPackageLevelDeclarations().size());
        return segments;
    }

    /**
     * Scans a package spec and identifies routine declarations.
     *
     * @param packageSpecSql Clean package spec SQL (comments removed)
     * @return Scanned segments, all without body
     */
    public PackageSegments scanPackageSpec(String packageSpecSql) {
        log.debug("Scanning package spec ({} chars)", packageSpecSql.length());
        scan(packageSpecSql);
        log.debug("Spec scan complete: found {} routine declarations", segments.getFunctionCount());
        return segments;
    }

    private void scan(String sql) {
        this.tokens = tokenizer.tokenize(sql);
        this.position = 0;
        this.segments = new PackageSegments();
        this.currentState = hasPackageHeader() ? State.HEADER : State.PACKAGE_LEVEL;

        while (position < tokens.size() && currentState != State.DONE) {
            SqlToken token = tokens.get(position);
            if (token.isWhitespace()) {
                position++;
                continue;
            }

            switch (currentState) {
                case HEADER:
                    handleHeader(token);
                    break;
                case PACKAGE_LEVEL:
                    handlePackageLevel(token);
                    break;
                case IN_SIGNATURE:
                    handleInSignature(token);
                    break;
                case IN_FUNCTION_BODY:
                    handleInFunctionBody(token);
                    break;
                default:
                    break;
            }

            position++;
        }

        if (currentState == State.IN_SIGNATURE || currentState == State.IN_FUNCTION_BODY) {
            log.warn("Routine {} is not terminated, ignoring its incomplete segment", currentFunctionName);
        }
    }

    // ========== State Handlers ==========

    private void handleHeader(SqlToken token) {
        if (token.isWord("PACKAGE")) {
            SqlToken name = nextSignificant(position);
            if (name != null && name.isWord("BODY")) {
                name = nextSignificant(indexOf(name));
            }
            if (name != null) {
                recordPackageName(name.getText());
            }
        } else if (token.isWord("IS") || token.isWord("AS")) {
            currentState = State.PACKAGE_LEVEL;
        }
    }

    private void handlePackageLevel(SqlToken token) {
        if (token.isWord("FUNCTION") || token.isWord("PROCEDURE")) {
            currentState = State.IN_SIGNATURE;
            currentFunctionStart = position;
            currentIsFunction = token.isWord("FUNCTION");
            SqlToken name = nextSignificant(position);
            currentFunctionName = name != null ? name.getText() : null;
            parenDepth = 0;
            log.trace("Found {} {} at token {}", token.getText(), currentFunctionName, position);
        } else if (token.isWord("END") || token.isWord("BEGIN")) {
            // END of package, or the body's initialization section: no more routines
            currentState = State.DONE;
        } else {
            int end = findStatementEnd(position);
            segments.addPackageLevelDeclaration(tokens.subList(position, end));
            position = end - 1; // -1 because main loop increments
        }
    }

    private void handleInSignature(SqlToken token) {
        if (token.isSymbol("(")) {
            parenDepth++;
        } else if (token.isSymbol(")")) {
            parenDepth--;
        } else if (parenDepth == 0 && token.isSymbol(";")) {
            // Spec entry or forward declaration
            addCurrentSegment(false);
            currentState = State.PACKAGE_LEVEL;
        } else if (parenDepth == 0 && (token.isWord("IS") || token.isWord("AS"))) {
            currentState = State.IN_FUNCTION_BODY;
            openers.clear();
            pendingNestedSubprograms = 0;
        }
    }

    private void handleInFunctionBody(SqlToken token) {
        if (openers.isEmpty() && (token.isWord("FUNCTION") || token.isWord("PROCEDURE"))) {
            if (hasBodyAhead(position)) {
                pendingNestedSubprograms++;
            }
        } else if (token.isWord("BEGIN")) {
            openers.push("BEGIN");
        } else if (token.isWord("CASE")) {
            openers.push("CASE");
        } else if (token.isWord("END")) {
            handleEnd();
        }
    }

    private void handleEnd() {
        SqlToken following = nextSignificant(position);
        if (following != null && (following.isWord("IF") || following.isWord("LOOP"))) {
            position = indexOf(following);
            return;
        }
        if (following != null && following.isWord("CASE")) {
            position = indexOf(following);
            openers.poll();
            return;
        }

        String closed = openers.poll();
        if (!openers.isEmpty() || !"BEGIN".equals(closed)) {
            return;
        }
        if (pendingNestedSubprograms > 0) {
            pendingNestedSubprograms--;
            return;
        }

        position = findStatementEnd(position) - 1;
        addCurrentSegment(true);
        currentState = State.PACKAGE_LEVEL;
    }

    // ========== Helpers ==========

    private void addCurrentSegment(boolean hasBody) {
        int end = position + 1;
        PackageSegments.FunctionSegment segment = new PackageSegments.FunctionSegment(
                currentFunctionName, currentIsFunction, hasBody,
                currentFunctionStart, end, tokens.subList(currentFunctionStart, end));
        segments.addFunction(segment);
        log.trace("Identified segment {}", segment);
    }

    private boolean hasPackageHeader() {
        for (SqlToken token : tokens) {
            if (token.isWhitespace()) {
                continue;
            }
            return token.isWord("CREATE") || token.isWord("PACKAGE");
        }
        return false;
    }

    private void recordPackageName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot > 0) {
            segments.setSchema(qualifiedName.substring(0, dot));
            segments.setPackageName(qualifiedName.substring(dot + 1));
        } else {
            segments.setPackageName(qualifiedName);
        }
    }

    /**
     * Checks whether a nested FUNCTION/PROCEDURE reaches IS/AS before ';'.
     */
    private boolean hasBodyAhead(int from) {
        int depth = 0;
        for (int i = from + 1; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(";")) {
                return false;
            } else if (depth == 0 && (token.isWord("IS") || token.isWord("AS"))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index after the next ';' at parenthesis depth 0, or the end of input.
     */
    private int findStatementEnd(int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && token.isSymbol(";")) {
                return i + 1;
            }
        }
        return tokens.size();
    }

    private SqlToken nextSignificant(int from) {
        for (int i = from + 1; i < tokens.size(); i++) {
            if (!tokens.get(i).isWhitespace()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private int indexOf(SqlToken token) {
        for (int i = position; i < tokens.size(); i++) {
            if (tokens.get(i) == token) {
                return i;
            }
        }
        return position;
    }
}
