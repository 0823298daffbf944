package org.iceforge.repocache.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "openIssues"})
public record OpenIssueCount(String name, long openIssues) implements RankEntry {
}
