package io.intellixity.vigil.source;

import java.time.Instant;

public record CpuMetric(Instant timestamp, String nodeName, double usage) {}
