package io.apicheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * The data under validation: a scalar, an ordered sequence or a key-value mapping, backed by a
 * Jackson {@link JsonNode} tree.
 *
 * <p>
 * The tree is deep-copied on construction so later changes to the caller's node cannot leak into
 * a validation in progress. Immutable and thread-safe as long as {@link #node()} is only read.
 */
public final class Instance {

    private final JsonNode node;

    private Instance(JsonNode node) {
        this.node = node;
    }

    /**
     * Wraps a JSON node. {@code null} and missing nodes become JSON null.
     *
     * @param node the node to wrap
     * @return an instance holding a private copy of the node
     */
    public static Instance of(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return new Instance(NullNode.getInstance());
        }
        return new Instance(node.deepCopy());
    }

    /** The root node. Callers must not mutate it. */
    public JsonNode node() {
        return node;
    }

    /** The runtime category of the root value. */
    public InstanceType type() {
        return InstanceType.of(node);
    }

    /**
     * Returns the value at the given instance location, or a missing node if the path does not
     * exist. Used to replay failure paths.
     */
    public JsonNode at(Location location) {
        return node.at(location.toPointer());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instance that)) return false;
        return node.equals(that.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node);
    }

    @Override
    public String toString() {
        return "Instance{" + node + "}";
    }
}
