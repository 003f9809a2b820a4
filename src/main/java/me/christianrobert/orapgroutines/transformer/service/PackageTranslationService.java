package me.christianrobert.orapgroutines.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.orapgroutines.config.service.ConfigService;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageSource;
import me.christianrobert.orapgroutines.core.job.model.routine.PackageTranslationReport;
import me.christianrobert.orapgroutines.core.tools.NameNormalizer;
import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.context.TransformationException;
import me.christianrobert.orapgroutines.transformer.context.TranslationContext;
import me.christianrobert.orapgroutines.transformer.cursor.CursorAnalysis;
import me.christianrobert.orapgroutines.transformer.cursor.CursorAttributeRewriter;
import me.christianrobert.orapgroutines.transformer.cursor.CursorStateAnalyzer;
import me.christianrobert.orapgroutines.transformer.cursor.TransformedRoutine;
import me.christianrobert.orapgroutines.transformer.emit.RoutineEmitter;
import me.christianrobert.orapgroutines.transformer.emit.RoutineNaming;
import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;
import me.christianrobert.orapgroutines.transformer.parser.PackageParseResult;
import me.christianrobert.orapgroutines.transformer.parser.PackageUnitBuilder;
import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;
import me.christianrobert.orapgroutines.transformer.visibility.VisibilityRegistry;
import me.christianrobert.orapgroutines.transformer.visibility.VisibilityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Translates the routines of Oracle packages into standalone PL/pgSQL routines.
 *
 * <p><strong>Two passes per package:</strong></p>
 * <ol>
 *   <li>Pass 1 (visibility): the package's public routine names are resolved from its spec
 *       and recorded in the run's registry. Must complete before Pass 2 reads them.</li>
 *   <li>Pass 2 (per body routine): cursor state analysis, attribute rewrite, emission.
 *       A failing routine yields a failure result; its siblings are unaffected.</li>
 * </ol>
 *
 * <p>The service itself is stateless; all run state lives in the {@link TranslationContext},
 * so Pass 2 of different packages may run on different threads.
 */
@ApplicationScoped
public class PackageTranslationService {

    private static final Logger log = LoggerFactory.getLogger(PackageTranslationService.class);

    @Inject
    ConfigService configService;

    private final VisibilityResolver visibilityResolver = new VisibilityResolver();

    /**
     * Creates the context of a new translation run from the current configuration.
     *
     * @throws IllegalArgumentException if the configured naming mode is unknown
     */
    public TranslationContext createContext() {
        RoutineNaming naming = RoutineNaming.fromConfig(
                configService.getConfigValueAsString(ConfigService.NAMING_MODE));
        String grantee = configService.getConfigValueAsString(ConfigService.REVOKE_GRANTEE);
        TranslationContext context = new TranslationContext(naming, grantee);
        log.debug("Created {}", context);
        return context;
    }

    /**
     * Builds the unit model of a package from its source text.
     *
     * @throws IllegalArgumentException if no package name is given or found in the source
     */
    public PackageParseResult parse(PackageSource source) {
        return new PackageUnitBuilder().build(source.getSchema(), source.getPackageName(),
                source.getSpecSql(), source.getBodySql());
    }

    /**
     * Pass 1 for one package.
     *
     * @throws IllegalStateException if the package was already registered with different public names
     */
    public Set<String> resolveVisibility(OraclePackage oraclePackage, TranslationContext context) {
        return visibilityResolver.resolve(oraclePackage, context.getVisibilityRegistry());
    }

    /**
     * Parses, resolves and translates one package. Never throws for bad input;
     * a package that cannot be parsed yields a failed report.
     */
    public PackageTranslationReport translatePackage(PackageSource source, TranslationContext context) {
        PackageParseResult parsed;
        try {
            parsed = parse(source);
            resolveVisibility(parsed.getOraclePackage(), context);
        } catch (TransformationException e) {
            log.warn("Package {} could not be parsed: {}", source.getDisplayName(), e.getMessage());
            return PackageTranslationReport.packageFailure(source.getDisplayName(), e.getDetailedMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Package {} rejected: {}", source.getDisplayName(), e.getMessage());
            return PackageTranslationReport.packageFailure(source.getDisplayName(), e.getMessage());
        }
        return translatePackage(parsed, context);
    }

    /**
     * Translates an already built package, resolving its visibility first if this run
     * has not done so yet.
     */
    public PackageTranslationReport translatePackage(OraclePackage oraclePackage, TranslationContext context) {
        return translatePackage(new PackageParseResult(oraclePackage, Collections.emptyList()), context);
    }

    /**
     * Pass 2 for a parsed package. Routines the parser rejected are reported as failures
     * after the translated ones.
     */
    public PackageTranslationReport translatePackage(PackageParseResult parsed, TranslationContext context) {
        OraclePackage oraclePackage = parsed.getOraclePackage();
        VisibilityRegistry registry = context.getVisibilityRegistry();
        if (!registry.isResolved(oraclePackage.getPackageKey())) {
            resolveVisibility(oraclePackage, context);
        }

        log.info("Translating package {} ({} routines)", oraclePackage.getQualifiedName(),
                oraclePackage.getBodyRoutines().size() + parsed.getFailures().size());

        RoutineEmitter emitter = context.createEmitter();
        List<RoutineTranslationResult> results = new ArrayList<>();
        for (RoutineDefinition routine : oraclePackage.getBodyRoutines()) {
            results.add(translateRoutine(oraclePackage, routine, context, emitter));
        }
        for (PackageParseResult.RoutineParseFailure failure : parsed.getFailures()) {
            boolean isPublic = registry.isPublic(oraclePackage.getPackageKey(),
                    NameNormalizer.normalizeIdentifier(failure.getRoutineName()));
            results.add(RoutineTranslationResult.failure(failure.getRoutineName(),
                    isPublic ? RoutineVisibility.PUBLIC : RoutineVisibility.PRIVATE, failure.getMessage()));
        }

        PackageTranslationReport report = new PackageTranslationReport(oraclePackage.getQualifiedName(),
                oraclePackage.hasSpec(), registry.getPublicNames(oraclePackage.getPackageKey()), results);
        log.info("Translated package {}: {}", oraclePackage.getQualifiedName(), report);
        return report;
    }

    /**
     * Pass 2 for one routine. The package's visibility must already be resolved.
     */
    public RoutineTranslationResult translateRoutine(OraclePackage oraclePackage, RoutineDefinition routine,
                                                     TranslationContext context, RoutineEmitter emitter) {
        RoutineVisibility visibility = RoutineVisibility.classify(oraclePackage, routine,
                context.getVisibilityRegistry());
        try {
            CursorAnalysis analysis = new CursorStateAnalyzer().analyze(routine,
                    oraclePackage.getQualifiedName(), oraclePackage.getPackageCursors());
            TransformedRoutine transformed = new CursorAttributeRewriter().rewrite(routine, analysis);
            return emitter.emit(oraclePackage, transformed, visibility);
        } catch (TransformationException e) {
            log.warn("Routine {}.{} could not be translated: {}",
                    oraclePackage.getQualifiedName(), routine.getName(), e.getMessage());
            return RoutineTranslationResult.failure(routine.getName(), visibility, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error translating routine " + oraclePackage.getQualifiedName()
                    + "." + routine.getName(), e);
            return RoutineTranslationResult.failure(routine.getName(), visibility,
                    "Unexpected error: " + e.getMessage());
        }
    }
}
