/**
 * <strong>Purpose:</strong> The batching loop that feeds a channel session from a sensor source.
 * <p><strong>Concurrency:</strong> One loop per session; cancellation arrives from another thread through
 * {@link ca.gc.cra.tide.application.ingest.CancellationToken}.</p>
 * <p><strong>Observability:</strong> Counters kept in {@link ca.gc.cra.tide.application.ingest.IngestionStatistics}
 * and summarized in the log.</p>
 */
package ca.gc.cra.tide.application.ingest;
