package com.irep.walk;

import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;

import java.util.List;

/**
 * Receives each fragment once its own selections are complete.
 */
@FunctionalInterface
public interface FragmentResolutionListener {

    /**
     * @param fragmentName The fragment's name.
     * @param definition The fragment definition, or null if the document never defines it.
     * @param spreads Every spread of this fragment in the document, in document order.
     */
    void onFragmentReady(String fragmentName, FragmentDefinition definition, List<FragmentSpread> spreads);
}
