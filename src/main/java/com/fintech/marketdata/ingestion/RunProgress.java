package com.fintech.marketdata.ingestion;

import java.time.Instant;

/**
 * Live progress of the active run.
 *
 * @param startedAt Run start
 * @param completed Tasks completed by this run so far
 */
public record RunProgress(Instant startedAt, long completed) {
}
