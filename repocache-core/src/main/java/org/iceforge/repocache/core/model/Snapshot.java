package org.iceforge.repocache.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one successful hydration produced. Never mutated; replaced wholesale.
 * <p>
 * Upstream payloads are deep-copied on construction, so later changes to the fetched nodes do
 * not leak in. The accessors hand out the snapshot's own nodes: callers must treat them as read-only.
 */
public record Snapshot(JsonNode organization,
                       List<JsonNode> members,
                       List<JsonNode> repos,
                       Map<ViewKind, RankedList> views,
                       Instant hydratedAt) {

    public Snapshot {
        Objects.requireNonNull(organization, "organization");
        Objects.requireNonNull(hydratedAt, "hydratedAt");
        organization = organization.deepCopy();
        members = deepCopyAll(members);
        repos = deepCopyAll(repos);
        for (ViewKind k : ViewKind.values()) {
            RankedList view = views.get(k);
            if (view == null) {
                throw new IllegalArgumentException("Missing view " + k);
            }
            if (view.size() != repos.size()) {
                throw new IllegalArgumentException("View " + k + " has " + view.size()
                        + " entries but snapshot has " + repos.size() + " repos");
            }
        }
        views = Map.copyOf(views);
    }

    private static List<JsonNode> deepCopyAll(List<JsonNode> nodes) {
        List<JsonNode> copies = new ArrayList<>(nodes.size());
        for (JsonNode n : nodes) {
            copies.add(n.deepCopy());
        }
        return List.copyOf(copies);
    }

    public RankedList view(ViewKind kind) {
        return views.get(kind);
    }
}
