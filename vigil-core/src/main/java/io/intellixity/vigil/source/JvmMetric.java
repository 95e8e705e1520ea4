package io.intellixity.vigil.source;

import java.math.BigDecimal;
import java.time.Instant;

/** Heap figures in KiB, rounded to two decimals. */
public record JvmMetric(Instant timestamp, String nodeName, BigDecimal heapUsed, BigDecimal heapMax, BigDecimal heapPercent) {}
