package com.irep.ir;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The built internal representation of one document: a root node per operation
 * and per fragment definition, keyed by definition name in document order.
 * Anonymous operations are keyed by the empty string.
 */
public class InternalRepresentation {

    private final Map<String, IrNode> operations;
    private final Map<String, IrNode> fragmentDefinitions;
    private final Set<String> unresolvedFragments;

    public InternalRepresentation(Map<String, IrNode> operations,
                                  Map<String, IrNode> fragmentDefinitions,
                                  Set<String> unresolvedFragments) {
        this.operations = Collections.unmodifiableMap(Objects.requireNonNull(operations, "operations is null"));
        this.fragmentDefinitions = Collections.unmodifiableMap(Objects.requireNonNull(fragmentDefinitions, "fragmentDefinitions is null"));
        this.unresolvedFragments = Collections.unmodifiableSet(Objects.requireNonNull(unresolvedFragments, "unresolvedFragments is null"));
    }

    public Map<String, IrNode> getOperations() {
        return operations;
    }

    public Map<String, IrNode> getFragmentDefinitions() {
        return fragmentDefinitions;
    }

    /**
     * @return Fragments that were never merged because they take part in (or depend on) a cycle.
     */
    public Set<String> getUnresolvedFragments() {
        return unresolvedFragments;
    }

    /**
     * Picks the operation to run. Without a name, the only operation of the document is
     * selected; a document with several operations then selects nothing.
     */
    public Optional<IrNode> selectOperation(String operationName) {
        if (operationName == null) {
            if (operations.size() == 1) {
                return Optional.of(operations.values().iterator().next());
            }
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(operationName));
    }
}
