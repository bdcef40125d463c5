package com.irep.walk;

import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.OperationDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Records which fragments every definition spreads, then reports fragments bottom-up:
 * a fragment is handed to the listener only after all fragments it spreads were handed over.
 * <p>
 * Fragments that are part of a cycle, or that depend on one, are never reported.
 */
public class FragmentDependencies implements DocumentVisitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentDependencies.class);

    private final Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    private final Map<String, List<FragmentSpread>> spreadsByFragment = new LinkedHashMap<>();
    private final Set<String> unresolvedFragments = new LinkedHashSet<>();

    private String currentFragment;
    private boolean resolved;

    @Override
    public void enterOperationDefinition(OperationDefinition node, VisitContext context) {
        currentFragment = null;
    }

    @Override
    public void enterFragmentDefinition(FragmentDefinition node, VisitContext context) {
        currentFragment = node.getName();
        // A repeated name replaces the earlier definition
        fragments.put(node.getName(), node);
        dependencies.put(node.getName(), new LinkedHashSet<>());
    }

    @Override
    public void leaveFragmentDefinition(FragmentDefinition node, VisitContext context) {
        currentFragment = null;
    }

    @Override
    public void enterFragmentSpread(FragmentSpread node, VisitContext context) {
        spreadsByFragment.computeIfAbsent(node.getName(), name -> new ArrayList<>()).add(node);
        if (currentFragment != null) {
            dependencies.get(currentFragment).add(node.getName());
        }
    }

    /**
     * Reports every spread or defined fragment to the listener exactly once, in dependency order.
     * Fragments that are spread but never defined come first, with a null definition.
     * @throws IllegalStateException if called more than once.
     */
    public void resolve(FragmentResolutionListener listener) {
        Objects.requireNonNull(listener, "listener is null");
        if (resolved) {
            throw new IllegalStateException("Fragment dependencies were already resolved");
        }
        resolved = true;

        Set<String> done = new LinkedHashSet<>();
        for (Map.Entry<String, List<FragmentSpread>> entry : spreadsByFragment.entrySet()) {
            if (!fragments.containsKey(entry.getKey())) {
                LOGGER.debug("Fragment {} is spread but never defined", entry.getKey());
                listener.onFragmentReady(entry.getKey(), null, spreadsOf(entry.getKey()));
                done.add(entry.getKey());
            }
        }

        boolean progress = true;
        while (progress) {
            progress = false;
            for (Map.Entry<String, FragmentDefinition> entry : fragments.entrySet()) {
                String name = entry.getKey();
                if (!done.contains(name) && done.containsAll(dependencies.get(name))) {
                    listener.onFragmentReady(name, entry.getValue(), spreadsOf(name));
                    done.add(name);
                    progress = true;
                }
            }
        }

        for (String name : fragments.keySet()) {
            if (!done.contains(name)) {
                unresolvedFragments.add(name);
            }
        }
        if (!unresolvedFragments.isEmpty()) {
            LOGGER.warn("Fragments with cyclic dependencies were not merged: {}", unresolvedFragments);
        }
    }

    /**
     * @return Defined fragments that {@link #resolve} could not report.
     */
    public Set<String> getUnresolvedFragments() {
        return Collections.unmodifiableSet(unresolvedFragments);
    }

    private List<FragmentSpread> spreadsOf(String fragmentName) {
        return Collections.unmodifiableList(spreadsByFragment.getOrDefault(fragmentName, Collections.emptyList()));
    }
}
