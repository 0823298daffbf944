package org.iceforge.repocache.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "updatedAt"})
public record LastUpdated(String name, Instant updatedAt) implements RankEntry {
}
