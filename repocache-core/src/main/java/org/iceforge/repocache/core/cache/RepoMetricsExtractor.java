package org.iceforge.repocache.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.repocache.core.model.RepoMetrics;
import org.iceforge.repocache.core.upstream.UpstreamDecodeException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls the ranked fields out of raw repository records. Any missing or malformed field
 * fails the whole batch.
 */
public final class RepoMetricsExtractor {

    private final String organization;

    public RepoMetricsExtractor(String organization) {
        this.organization = Objects.requireNonNull(organization, "organization");
    }

    public List<RepoMetrics> extractAll(List<JsonNode> repos) {
        List<RepoMetrics> out = new ArrayList<>(repos.size());
        for (int i = 0; i < repos.size(); i++) {
            out.add(extract(repos.get(i), i));
        }
        return out;
    }

    RepoMetrics extract(JsonNode repo, int index) {
        if (repo == null || !repo.isObject()) {
            throw new UpstreamDecodeException("Repository #" + index + " is not a JSON object");
        }
        String name = text(repo, "name", index);
        return new RepoMetrics(
                organization + "/" + name,
                count(repo, "forks_count", name),
                count(repo, "open_issues_count", name),
                count(repo, "stargazers_count", name),
                timestamp(repo, "updated_at", name)
        );
    }

    private static String text(JsonNode repo, String field, int index) {
        JsonNode n = repo.get(field);
        if (n == null || !n.isTextual() || n.asText().isBlank()) {
            throw new UpstreamDecodeException("Repository #" + index + " has no usable '" + field + "'");
        }
        return n.asText();
    }

    private static long count(JsonNode repo, String field, String name) {
        JsonNode n = repo.get(field);
        if (n == null || !n.isIntegralNumber() || n.asLong() < 0) {
            throw new UpstreamDecodeException("Repository " + name + " has no usable '" + field + "'");
        }
        return n.asLong();
    }

    private static Instant timestamp(JsonNode repo, String field, String name) {
        JsonNode n = repo.get(field);
        if (n == null || !n.isTextual()) {
            throw new UpstreamDecodeException("Repository " + name + " has no usable '" + field + "'");
        }
        try {
            return OffsetDateTime.parse(n.asText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new UpstreamDecodeException("Repository " + name + " has malformed '" + field + "': " + n.asText(), e);
        }
    }
}
