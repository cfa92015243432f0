package com.libragraph.atomizer.core.dispatch;

import com.libragraph.atomizer.formats.api.AtomComposition;

import java.util.List;

/**
 * Every node visited by one dispatch, in visiting order (root first), plus the edges
 * composing each successful child root into its parent.
 */
public record DispatchResult(List<NodeOutcome> nodes, List<AtomComposition> links) {

    public DispatchResult {
        nodes = List.copyOf(nodes);
        links = List.copyOf(links);
    }

    public NodeOutcome.Succeeded root() {
        return (NodeOutcome.Succeeded) nodes.get(0);
    }

    public List<NodeOutcome.Succeeded> succeeded() {
        return nodes.stream()
                .filter(NodeOutcome.Succeeded.class::isInstance)
                .map(NodeOutcome.Succeeded.class::cast)
                .toList();
    }

    public List<NodeOutcome.Failed> failed() {
        return nodes.stream()
                .filter(NodeOutcome.Failed.class::isInstance)
                .map(NodeOutcome.Failed.class::cast)
                .toList();
    }
}
