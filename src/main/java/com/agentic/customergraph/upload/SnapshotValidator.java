package com.agentic.customergraph.upload;

import com.agentic.customergraph.core.Entity;
import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.core.Relationship;
import com.agentic.customergraph.exception.CrossCustomerViolationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a snapshot before upload. A snapshot holding another customer's data
 * raises {@link CrossCustomerViolationException}; structural problems are
 * returned as messages.
 */
final class SnapshotValidator {

    private SnapshotValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    static List<String> validate(String customerId, String extractionId, GraphSnapshot snapshot) {
        requireCustomer(customerId, extractionId, snapshot.customerId());

        List<String> problems = new ArrayList<>();
        if (!extractionId.equals(snapshot.extractionId())) {
            problems.add("snapshot extraction id " + snapshot.extractionId() + " does not match key " + extractionId);
        }

        Set<String> nodeIds = new HashSet<>();
        for (Entity node : snapshot.nodes()) {
            requireCustomer(customerId, extractionId, node.getCustomerId());
            nodeIds.add(node.getId());
        }
        for (Relationship edge : snapshot.edges()) {
            requireCustomer(customerId, extractionId, edge.getCustomerId());
            if (!edge.hasEvidence()) {
                problems.add("edge " + edge.getId() + " has no evidence");
            }
            if (!nodeIds.contains(edge.getSourceId()) || !nodeIds.contains(edge.getTargetId())) {
                problems.add("edge " + edge.getId() + " references a node outside the snapshot");
            }
        }
        return problems;
    }

    static void requireCustomer(String customerId, String extractionId, String actualCustomerId) {
        if (!customerId.equals(actualCustomerId)) {
            throw new CrossCustomerViolationException(customerId, extractionId, actualCustomerId);
        }
    }
}
