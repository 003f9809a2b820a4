package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.transformer.model.OraclePackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A package built from source text, plus the body routines that could not be parsed.
 */
public class PackageParseResult {

    private final OraclePackage oraclePackage;
    private final List<RoutineParseFailure> failures;

    public PackageParseResult(OraclePackage oraclePackage, List<RoutineParseFailure> failures) {
        this.oraclePackage = oraclePackage;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public OraclePackage getOraclePackage() {
        return oraclePackage;
    }

    public List<RoutineParseFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A body routine rejected by the parser.
     */
    public static class RoutineParseFailure {

        private final String routineName;
        private final String message;

        public RoutineParseFailure(String routineName, String message) {
            this.routineName = routineName;
            this.message = message;
        }

        public String getRoutineName() {
            return routineName;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return routineName + ": " + message;
        }
    }
}
