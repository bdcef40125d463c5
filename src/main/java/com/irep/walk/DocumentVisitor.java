package com.irep.walk;

import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;

/**
 * Callbacks invoked by {@link DocumentWalker} while it walks a document depth-first.
 * Every enter call is matched by a leave call after all of the node's children were left.
 * Fragment spreads have no children and only get an enter call.
 */
public interface DocumentVisitor {

    default void enterOperationDefinition(OperationDefinition node, VisitContext context) {
    }

    default void leaveOperationDefinition(OperationDefinition node, VisitContext context) {
    }

    default void enterFragmentDefinition(FragmentDefinition node, VisitContext context) {
    }

    default void leaveFragmentDefinition(FragmentDefinition node, VisitContext context) {
    }

    default void enterInlineFragment(InlineFragment node, VisitContext context) {
    }

    default void leaveInlineFragment(InlineFragment node, VisitContext context) {
    }

    default void enterField(Field node, VisitContext context) {
    }

    default void leaveField(Field node, VisitContext context) {
    }

    default void enterFragmentSpread(FragmentSpread node, VisitContext context) {
    }
}
