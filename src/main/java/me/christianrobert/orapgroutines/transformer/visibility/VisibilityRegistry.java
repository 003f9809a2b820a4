package me.christianrobert.orapgroutines.transformer.visibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped store of public routine names per package.
 *
 * <p>Keys are folded {@code schema.package} names, values the folded names of routines
 * declared in the package spec. One instance belongs to one translation run and is passed
 * explicitly to everything that needs it; it is safe to share between worker threads.
 *
 * <p>Each package is registered once: registering the same set again is a no-op,
 * registering a different set is a programming error. Querying a package that was never
 * registered is an error too, so Pass 2 cannot run ahead of Pass 1 for that package.
 */
public class VisibilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(VisibilityRegistry.class);

    private final Map<String, Set<String>> publicNamesByPackage = new ConcurrentHashMap<>();

    /**
     * Records the public routine names of a package.
     *
     * @param packageKey folded package key (see OraclePackage.getPackageKey)
     * @param publicNames folded public routine names
     * @throws IllegalStateException if the package is already registered with different names
     */
    public void register(String packageKey, Set<String> publicNames) {
        Set<String> frozen = Collections.unmodifiableSet(new TreeSet<>(publicNames));
        Set<String> existing = publicNamesByPackage.putIfAbsent(packageKey, frozen);
        if (existing == null) {
            log.debug("Registered {} public routines for package {}", frozen.size(), packageKey);
        } else if (!existing.equals(frozen)) {
            throw new IllegalStateException("Visibility of package " + packageKey
                    + " is already registered with different routines: " + existing + " vs " + frozen);
        }
    }

    public boolean isResolved(String packageKey) {
        return publicNamesByPackage.containsKey(packageKey);
    }

    /**
     * Whether the routine is declared in the package spec.
     *
     * @param packageKey folded package key
     * @param foldedRoutineName folded routine name
     * @throws IllegalStateException if the package's visibility was never resolved
     */
    public boolean isPublic(String packageKey, String foldedRoutineName) {
        Set<String> publicNames = publicNamesByPackage.get(packageKey);
        if (publicNames == null) {
            throw new IllegalStateException("Visibility of package " + packageKey
                    + " has not been resolved yet");
        }
        return publicNames.contains(foldedRoutineName);
    }

    /**
     * Public names of a resolved package, or an empty set if it was never registered.
     */
    public Set<String> getPublicNames(String packageKey) {
        return publicNamesByPackage.getOrDefault(packageKey, Collections.emptySet());
    }

    public int getPackageCount() {
        return publicNamesByPackage.size();
    }
}
