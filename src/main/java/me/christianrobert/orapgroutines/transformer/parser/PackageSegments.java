package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of scanning a package spec or body: the package header name, the routine
 * segments, and the package-level declarations found outside any routine.
 *
 * Each FunctionSegment holds the tokens of one routine from its FUNCTION/PROCEDURE
 * keyword through the terminating ';', so it can be parsed on its own.
 */
public class PackageSegments {

    private final List<FunctionSegment> functions = new ArrayList<>();
    private final List<List<SqlToken>> packageLevelDeclarations = new ArrayList<>();
    private String schema;
    private String packageName;

    public void addFunction(FunctionSegment segment) {
        functions.add(segment);
    }

    public void addPackageLevelDeclaration(List<SqlToken> declarationTokens) {
        packageLevelDeclarations.add(SqlTokens.immutableCopy(declarationTokens));
    }

    /**
     * Returns all identified function segments in source order.
     */
    public List<FunctionSegment> getFunctions() {
        return new ArrayList<>(functions);
    }

    public int getFunctionCount() {
        return functions.size();
    }

    /**
     * Declarations at package level (variables, types, cursors), each ending with ';'.
     */
    public List<List<SqlToken>> getPackageLevelDeclarations() {
        return new ArrayList<>(packageLevelDeclarations);
    }

    /** Schema from the CREATE PACKAGE header, null when unqualified or absent */
    public String getSchema() {
        return schema;
    }

    void setSchema(String schema) {
        this.schema = schema;
    }

    /** Package name from the CREATE PACKAGE header, null when absent */
    public String getPackageName() {
        return packageName;
    }

    void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    /**
     * A single function or procedure within a package.
     */
    public static class FunctionSegment {

        private final String name;
        private final boolean isFunction;
        private final boolean hasBody;
        private final int startIndex;   // token index of FUNCTION/PROCEDURE keyword
        private final int endIndex;     // token index after the final ';'
        private final List<SqlToken> tokens;

        /**
         * @param name Function/procedure name as written
         * @param isFunction true for FUNCTION, false for PROCEDURE
         * @param hasBody false for spec entries and forward declarations
         * @param startIndex token index where the FUNCTION/PROCEDURE keyword starts
         * @param endIndex token index after the final ';'
         * @param tokens the segment's tokens
         */
        public FunctionSegment(String name, boolean isFunction, boolean hasBody,
                               int startIndex, int endIndex, List<SqlToken> tokens) {
            this.name = name;
            this.isFunction = isFunction;
            this.hasBody = hasBody;
            this.startIndex = startIndex;
            this.endIndex = endIndex;
            this.tokens = SqlTokens.immutableCopy(tokens);
        }

        public String getName() {
            return name;
        }

        public boolean isFunction() {
            return isFunction;
        }

        public boolean isProcedure() {
            return !isFunction;
        }

        public boolean hasBody() {
            return hasBody;
        }

        public int getStartIndex() {
            return startIndex;
        }

        public int getEndIndex() {
            return endIndex;
        }

        public List<SqlToken> getTokens() {
            return tokens;
        }

        public String getText() {
            return SqlToken.join(tokens);
        }

        @Override
        public String toString() {
            return String.format("%s %s [%d-%d%s]",
                    isFunction ? "FUNCTION" : "PROCEDURE",
                    name,
                    startIndex, endIndex,
                    hasBody ? "" : ", declaration");
        }
    }
}
