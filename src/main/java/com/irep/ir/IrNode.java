package com.irep.ir;

import com.irep.schema.TypeContext;
import graphql.language.Node;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One selection in the internal representation: a response key selected on an owner type.
 * <p>
 * Children are kept per owner type in {@link #getScopedChildren()}, where the owner may be a
 * union or interface. {@link #getTypedChildren()} expands those owners to their concrete types.
 * Nodes are shared by reference when a fragment is merged into several parents.
 */
public class IrNode {

    private final TypeContext typeContext;
    private final String name;
    private final GraphQLNamedType ownerType;
    private final GraphQLNamedType returnType;

    // Insertion ordered so the representative accessors are deterministic
    private final Set<Node<?>> astNodes = new LinkedHashSet<>();
    private final Set<GraphQLFieldDefinition> definitions = new LinkedHashSet<>();
    private final Map<GraphQLNamedType, Map<String, IrNode>> scopedChildren = new LinkedHashMap<>();

    private Map<GraphQLNamedType, Map<String, IrNode>> typedChildren;
    private Node<?> astNode;
    private GraphQLFieldDefinition definition;
    private String definitionName;

    /**
     * @param typeContext Used to expand abstract owner types.
     * @param name Response key (alias or field name), or the definition name for roots.
     * @param ownerType The type this selection was made on.
     * @param returnType The unwrapped type the selection returns.
     */
    public IrNode(TypeContext typeContext, String name, GraphQLNamedType ownerType, GraphQLNamedType returnType) {
        this.typeContext = Objects.requireNonNull(typeContext, "typeContext is null");
        this.name = Objects.requireNonNull(name, "name is null");
        this.ownerType = ownerType;
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public GraphQLNamedType getOwnerType() {
        return ownerType;
    }

    public GraphQLNamedType getReturnType() {
        return returnType;
    }

    /**
     * @return AST nodes (fields, operation or fragment definitions) represented by this node.
     */
    public Set<Node<?>> getAstNodes() {
        return Collections.unmodifiableSet(astNodes);
    }

    /**
     * @return Field definitions backing this node. Usually one, more when selections
     *         on different implementations of an interface were merged.
     */
    public Set<GraphQLFieldDefinition> getDefinitions() {
        return Collections.unmodifiableSet(definitions);
    }

    public void addAstNode(Node<?> node) {
        astNodes.add(Objects.requireNonNull(node, "node is null"));
    }

    public void addDefinition(GraphQLFieldDefinition fieldDefinition) {
        definitions.add(Objects.requireNonNull(fieldDefinition, "fieldDefinition is null"));
    }

    /**
     * @return The first AST node seen for this selection, cached after the first read.
     */
    public Node<?> getAstNode() {
        if (astNode == null && !astNodes.isEmpty()) {
            astNode = astNodes.iterator().next();
        }
        return astNode;
    }

    public GraphQLFieldDefinition getDefinition() {
        if (definition == null && !definitions.isEmpty()) {
            definition = definitions.iterator().next();
        }
        return definition;
    }

    public String getDefinitionName() {
        if (definitionName == null && getDefinition() != null) {
            definitionName = getDefinition().getName();
        }
        return definitionName;
    }

    /**
     * @return Read-only view of owner type to (response key to node).
     */
    public Map<GraphQLNamedType, Map<String, IrNode>> getScopedChildren() {
        return Collections.unmodifiableMap(scopedChildren);
    }

    /**
     * Returns the child selected under {@code owner} with response key {@code key},
     * creating it if this is the first selection of that key on that owner.
     */
    public IrNode getOrCreateChild(GraphQLNamedType owner, String key, GraphQLNamedType childReturnType) {
        Map<String, IrNode> children = scopedChildren.computeIfAbsent(owner, t -> new LinkedHashMap<>());
        IrNode child = children.get(key);
        if (child == null) {
            child = new IrNode(typeContext, key, owner, childReturnType);
            children.put(key, child);
        }
        return child;
    }

    /**
     * Concrete type to (response key to node), with every union or interface owner
     * expanded to its possible types. A key selected on several owners of one concrete type
     * maps to a new node combining them; the scoped children are left untouched.
     * Computed on first call and frozen afterwards, so it should only be read once the
     * document has been fully built.
     */
    public Map<GraphQLNamedType, Map<String, IrNode>> getTypedChildren() {
        if (typedChildren == null) {
            Map<GraphQLNamedType, Map<String, IrNode>> result = new LinkedHashMap<>();
            // Nodes created by this expansion; only these may be written to
            Set<IrNode> combined = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Map.Entry<GraphQLNamedType, Map<String, IrNode>> entry : scopedChildren.entrySet()) {
                for (GraphQLNamedType concreteType : concreteOwnerTypes(entry.getKey())) {
                    Map<String, IrNode> typeChildren = result.computeIfAbsent(concreteType, t -> new LinkedHashMap<>());
                    combineChildren(typeChildren, entry.getValue(), combined);
                }
            }
            Map<GraphQLNamedType, Map<String, IrNode>> frozen = new LinkedHashMap<>();
            result.forEach((type, children) -> frozen.put(type, Collections.unmodifiableMap(children)));
            typedChildren = Collections.unmodifiableMap(frozen);
        }
        return typedChildren;
    }

    /**
     * Merges the children of {@code source} into this node in place.
     * Keys missing here adopt the source node by reference; keys present on both sides
     * get their AST nodes and definitions unioned and are merged recursively.
     * Running the same merge again changes nothing.
     */
    public void mergeSelections(IrNode source) {
        if (source == this) {
            return;
        }
        for (Map.Entry<GraphQLNamedType, Map<String, IrNode>> entry : source.scopedChildren.entrySet()) {
            Map<String, IrNode> children = scopedChildren.computeIfAbsent(entry.getKey(), t -> new LinkedHashMap<>());
            mergeChildren(children, entry.getValue());
        }
    }

    private static void mergeChildren(Map<String, IrNode> target, Map<String, IrNode> source) {
        for (Map.Entry<String, IrNode> entry : source.entrySet()) {
            IrNode existing = target.get(entry.getKey());
            IrNode incoming = entry.getValue();
            if (existing == null) {
                target.put(entry.getKey(), incoming);
            } else if (existing != incoming) {
                existing.astNodes.addAll(incoming.astNodes);
                existing.definitions.addAll(incoming.definitions);
                existing.mergeSelections(incoming);
            }
        }
    }

    /**
     * Like {@link #mergeChildren} but never writes to a node it did not create: a key seen on
     * both sides is replaced by a copy of the existing node, which then takes the incoming one.
     */
    private static void combineChildren(Map<String, IrNode> target, Map<String, IrNode> source, Set<IrNode> combined) {
        for (Map.Entry<String, IrNode> entry : source.entrySet()) {
            IrNode existing = target.get(entry.getKey());
            IrNode incoming = entry.getValue();
            if (existing == null) {
                target.put(entry.getKey(), incoming);
            } else if (existing != incoming) {
                IrNode copy = combined.contains(existing) ? existing : existing.shallowCopy(combined);
                target.put(entry.getKey(), copy);
                copy.astNodes.addAll(incoming.astNodes);
                copy.definitions.addAll(incoming.definitions);
                for (Map.Entry<GraphQLNamedType, Map<String, IrNode>> owner : incoming.scopedChildren.entrySet()) {
                    Map<String, IrNode> children = copy.scopedChildren.computeIfAbsent(owner.getKey(), t -> new LinkedHashMap<>());
                    combineChildren(children, owner.getValue(), combined);
                }
            }
        }
    }

    private IrNode shallowCopy(Set<IrNode> combined) {
        IrNode copy = new IrNode(typeContext, name, ownerType, returnType);
        copy.astNodes.addAll(astNodes);
        copy.definitions.addAll(definitions);
        scopedChildren.forEach((owner, children) -> copy.scopedChildren.put(owner, new LinkedHashMap<>(children)));
        combined.add(copy);
        return copy;
    }

    private Collection<GraphQLNamedType> concreteOwnerTypes(GraphQLNamedType owner) {
        if (owner instanceof GraphQLObjectType || owner instanceof GraphQLScalarType || owner instanceof GraphQLEnumType) {
            return Collections.singleton(owner);
        }
        if (typeContext.isAbstract(owner)) {
            return typeContext.possibleConcreteTypes(owner);
        }
        if (owner == null || owner instanceof GraphQLInputObjectType) {
            // Not a valid owner, nothing can be selected on it
            return Collections.emptySet();
        }
        throw new IllegalStateException("Unexpected owner type: " + owner.getName() + " (" + owner.getClass().getSimpleName() + ")");
    }

    /**
     * Renders this node and its typed children, one selection per line.
     * @param indent Indentation for this level.
     */
    public String toString(String indent) {
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(this).append("\n");
        for (Map.Entry<GraphQLNamedType, Map<String, IrNode>> entry : getTypedChildren().entrySet()) {
            sb.append(indent).append("  on ").append(entry.getKey().getName()).append(":\n");
            for (IrNode child : entry.getValue().values()) {
                sb.append(child.toString(indent + "    "));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "IrNode[" + typeName(ownerType) + "." + name + " -> " + typeName(returnType) + "]";
    }

    private static String typeName(GraphQLNamedType type) {
        return type == null ? "?" : type.getName();
    }
}
