package org.shellgo.compiler.backend.emit;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What the emission pass may use, as found by the collection pass.
 *
 * @param imports Go packages, in lexical order.
 * @param helpers Runtime helpers, in declaration order.
 * @param jobScopes Functions that run background work; the entry point is the empty name.
 */
public record GoDependencies(SortedSet<String> imports, Set<RuntimeHelper> helpers, Set<String> jobScopes) {

    public GoDependencies {
        imports = Collections.unmodifiableSortedSet(new TreeSet<>(imports));
        helpers = Collections.unmodifiableSet(helpers.isEmpty()
                ? EnumSet.noneOf(RuntimeHelper.class)
                : EnumSet.copyOf(helpers));
        jobScopes = Collections.unmodifiableSet(new TreeSet<>(jobScopes));
    }
}
