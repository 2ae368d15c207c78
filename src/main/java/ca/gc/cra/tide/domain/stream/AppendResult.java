package ca.gc.cra.tide.domain.stream;

/**
 * Outcome of a successful append.
 *
 * @param offset offset committed locally after the append; {@code -1} for the empty no-op result
 * @param rows number of records sent
 * @param bytes size of the NDJSON payload in bytes
 * @since 0.1.0
 */
public record AppendResult(long offset, int rows, long bytes) {
  private static final AppendResult EMPTY = new AppendResult(-1L, 0, 0L);

  /**
   * Result returned when {@code append} is called with no records.
   *
   * @return shared empty result
   */
  public static AppendResult empty() {
    return EMPTY;
  }

  /**
   * Indicates whether any data was sent.
   *
   * @return {@code true} for the no-op result
   */
  public boolean isEmpty() {
    return rows == 0;
  }
}
