package io.intellixity.vigil.source;

import java.time.Instant;

/** Elasticsearch cluster health as exported to Prometheus. */
public record ClusterMetrics(String health,
                             long nodeCount,
                             long dataNodeCount,
                             long primaryShards,
                             long unassignedShards,
                             long documentCount,
                             Instant timestamp) {}
