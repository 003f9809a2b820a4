package me.christianrobert.orapgroutines.transformer.parser;

import me.christianrobert.orapgroutines.core.tools.CodeCleaner;
import me.christianrobert.orapgroutines.transformer.context.TransformationException;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.Declaration;
import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.model.RoutineKind;
import me.christianrobert.orapgroutines.transformer.model.RoutineSignature;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the unit model of one package from its spec and body source.
 *
 * <p>Pipeline per part: CodeCleaner.removeComments, FunctionBoundaryScanner, then
 * RoutineBodyParser per segment. A body routine the parser rejects is reported as a
 * failure and left out of the package; the remaining routines are unaffected.
 */
public class PackageUnitBuilder {

    private static final Logger log = LoggerFactory.getLogger(PackageUnitBuilder.class);

    /**
     * @param schema   owning schema, null to take it from the body header
     * @param name     package name, null to take it from the header
     * @param specSql  package spec source; null or blank when the package has no spec
     * @param bodySql  package body source
     */
    public PackageParseResult build(String schema, String name, String specSql, String bodySql) {
        boolean hasSpec = specSql != null && !specSql.isBlank();

        PackageSegments specSegments = null;
        List<RoutineSignature> specRoutines = new ArrayList<>();
        if (hasSpec) {
            specSegments = new FunctionBoundaryScanner().scanPackageSpec(CodeCleaner.removeComments(specSql));
            for (PackageSegments.FunctionSegment segment : specSegments.getFunctions()) {
                specRoutines.add(parseSpecEntry(segment));
            }
        }

        PackageSegments bodySegments = bodySql == null || bodySql.isBlank()
                ? new PackageSegments()
                : new FunctionBoundaryScanner().scanPackageBody(CodeCleaner.removeComments(bodySql));

        String packageName = firstNonBlank(name, bodySegments.getPackageName(),
                specSegments != null ? specSegments.getPackageName() : null);
        String packageSchema = firstNonBlank(schema, bodySegments.getSchema(),
                specSegments != null ? specSegments.getSchema() : null);
        if (packageName == null) {
            throw new IllegalArgumentException("Package name is neither given nor present in a CREATE PACKAGE header");
        }

        List<RoutineDefinition> bodyRoutines = new ArrayList<>();
        List<PackageParseResult.RoutineParseFailure> failures = new ArrayList<>();
        for (PackageSegments.FunctionSegment segment : bodySegments.getFunctions()) {
            if (!segment.hasBody()) {
                log.trace("Skipping forward declaration of {}", segment.getName());
                continue;
            }
            try {
                bodyRoutines.add(new RoutineBodyParser().parseRoutine(segment.getTokens()));
            } catch (TransformationException e) {
                log.warn("Failed to parse routine {}.{}: {}", packageName, segment.getName(), e.getMessage());
                failures.add(new PackageParseResult.RoutineParseFailure(segment.getName(), e.getDetailedMessage()));
            }
        }

        List<CursorDeclaration> packageCursors = new ArrayList<>();
        RoutineBodyParser declarationParser = new RoutineBodyParser();
        for (List<SqlToken> declarationTokens : bodySegments.getPackageLevelDeclarations()) {
            try {
                Declaration declaration = declarationParser.parseDeclaration(declarationTokens);
                if (declaration instanceof CursorDeclaration) {
                    packageCursors.add((CursorDeclaration) declaration);
                }
            } catch (TransformationException e) {
                log.warn("Skipping package-level declaration of {}: {}", packageName, e.getMessage());
            }
        }

        OraclePackage oraclePackage = new OraclePackage(packageSchema, packageName, hasSpec,
                specRoutines, bodyRoutines, packageCursors);
        log.debug("Built {} ({} failures)", oraclePackage, failures.size());
        return new PackageParseResult(oraclePackage, failures);
    }

    private RoutineSignature parseSpecEntry(PackageSegments.FunctionSegment segment) {
        try {
            return new RoutineBodyParser().parseSignature(segment.getTokens());
        } catch (TransformationException e) {
            // The name alone is enough to classify the routine as public
            log.warn("Could not parse spec declaration of {}, keeping name only: {}",
                    segment.getName(), e.getMessage());
            return new RoutineSignature(segment.getName(),
                    segment.isFunction() ? RoutineKind.FUNCTION : RoutineKind.PROCEDURE,
                    Collections.emptyList(), null);
        }
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
