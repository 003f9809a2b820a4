package me.christianrobert.orapgroutines.transformer.visibility;

import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.RoutineSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pass 1: determines which routines of a package are public.
 *
 * A routine is public when its name is declared in the package spec, compared
 * case-insensitively. Overloads share the name and therefore the classification.
 */
public class VisibilityResolver {

    private static final Logger log = LoggerFactory.getLogger(VisibilityResolver.class);

    /**
     * Computes the public name set of a package and records it in the registry.
     *
     * @return sorted, unmodifiable set of folded public routine names; empty when the
     *         package has no spec or an empty one
     */
    public Set<String> resolve(OraclePackage oraclePackage, VisibilityRegistry registry) {
        Set<String> publicNames = new TreeSet<>();
        if (oraclePackage.hasSpec()) {
            for (RoutineSignature declared : oraclePackage.getSpecRoutines()) {
                publicNames.add(declared.getFoldedName());
            }
        } else {
            log.info("Package {} has no spec, all {} body routines are private",
                    oraclePackage.getQualifiedName(), oraclePackage.getBodyRoutines().size());
        }

        Set<String> result = Collections.unmodifiableSet(publicNames);
        registry.register(oraclePackage.getPackageKey(), result);
        log.debug("Resolved visibility of {}: public {}", oraclePackage.getQualifiedName(), result);
        return result;
    }
}
