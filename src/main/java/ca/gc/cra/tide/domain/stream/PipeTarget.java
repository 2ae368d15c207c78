package ca.gc.cra.tide.domain.stream;

import ca.gc.cra.tide.validation.Strings;

/**
 * Fully qualified pipe that channels append into, with the REST path fragments derived from it.
 *
 * @param database target database name
 * @param schema target schema name
 * @param pipe target pipe name
 * @since 0.1.0
 */
public record PipeTarget(String database, String schema, String pipe) {
  public PipeTarget {
    database = Strings.requireIdentifier("database", database);
    schema = Strings.requireIdentifier("schema", schema);
    pipe = Strings.requireIdentifier("pipe", pipe);
  }

  /**
   * Returns {@code /databases/{db}/schemas/{schema}/pipes/{pipe}}.
   *
   * @return path fragment shared by channel-scoped endpoints
   */
  public String pipePath() {
    return "/databases/" + database + "/schemas/" + schema + "/pipes/" + pipe;
  }

  /**
   * Returns the channel path fragment under this pipe.
   *
   * @param channel channel name
   * @return {@code pipePath() + /channels/{channel}}
   */
  public String channelPath(String channel) {
    return pipePath() + "/channels/" + channel;
  }

  /**
   * Dotted name used in log lines.
   *
   * @return {@code database.schema.pipe}
   */
  public String qualifiedName() {
    return database + "." + schema + "." + pipe;
  }
}
