package me.christianrobert.orapgroutines.transformer.visibility;

import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineDefinition;

/**
 * Whether a translated routine stays callable by everyone or gets its access revoked.
 */
public enum RoutineVisibility {
    PUBLIC,
    PRIVATE;

    public boolean isPublic() {
        return this == PUBLIC;
    }

    /**
     * Looks up a body routine in the registry filled by Pass 1.
     *
     * @throws IllegalStateException if the package's visibility was never resolved
     */
    public static RoutineVisibility classify(OraclePackage oraclePackage, RoutineDefinition routine,
                                             VisibilityRegistry registry) {
        return registry.isPublic(oraclePackage.getPackageKey(), routine.getSignature().getFoldedName())
                ? PUBLIC
                : PRIVATE;
    }
}
