package me.christianrobert.orapgroutines.transformer.context;

import me.christianrobert.orapgroutines.transformer.emit.RoutineEmitter;
import me.christianrobert.orapgroutines.transformer.emit.RoutineNaming;
import me.christianrobert.orapgroutines.transformer.visibility.VisibilityRegistry;

import java.util.Objects;

/**
 * Run-scoped state shared by all packages of one translation run.
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>Created at the start of a run from the current configuration</li>
 *   <li>The visibility registry fills up during Pass 1 and is only read afterwards</li>
 *   <li>Never cached; garbage collected when the run completes</li>
 * </ul>
 *
 * <p>Naming mode and grantee are fixed at creation, so a configuration change during a
 * run does not affect routines of that run.
 */
public class TranslationContext {

    private final VisibilityRegistry visibilityRegistry;
    private final RoutineNaming naming;
    private final String revokeGrantee;

    public TranslationContext(RoutineNaming naming, String revokeGrantee) {
        this(new VisibilityRegistry(), naming, revokeGrantee);
    }

    public TranslationContext(VisibilityRegistry visibilityRegistry, RoutineNaming naming, String revokeGrantee) {
        this.visibilityRegistry = Objects.requireNonNull(visibilityRegistry, "visibilityRegistry");
        this.naming = naming != null ? naming : RoutineNaming.DEFAULT;
        this.revokeGrantee = revokeGrantee;
    }

    public VisibilityRegistry getVisibilityRegistry() {
        return visibilityRegistry;
    }

    public RoutineNaming getNaming() {
        return naming;
    }

    public String getRevokeGrantee() {
        return revokeGrantee;
    }

    /**
     * Emitters are stateless apart from their settings; workers may each create one.
     */
    public RoutineEmitter createEmitter() {
        return new RoutineEmitter(naming, revokeGrantee);
    }

    @Override
    public String toString() {
        return "TranslationContext{naming=" + naming
                + ", revokeGrantee=" + revokeGrantee
                + ", resolvedPackages=" + visibilityRegistry.getPackageCount() + "}";
    }
}
