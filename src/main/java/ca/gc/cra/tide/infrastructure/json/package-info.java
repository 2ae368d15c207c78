/** Jackson streaming helpers for JSON documents and NDJSON row payloads. */
package ca.gc.cra.tide.infrastructure.json;
