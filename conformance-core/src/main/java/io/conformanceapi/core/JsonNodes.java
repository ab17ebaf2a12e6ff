package io.conformanceapi.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

final class JsonNodes {

    private JsonNodes() {
    }

    /**
     * Treats a JSON {@code null} or missing node as absent, so it is omitted on write instead of written as null.
     */
    static Optional<JsonNode> present(Optional<JsonNode> node) {
        if (node == null) return Optional.empty();
        return node.filter(n -> !n.isNull() && !n.isMissingNode());
    }
}
