package org.openrepo.oaipmh.domain.entity;

import static org.openrepo.oaipmh.Constants.DELETED_RECORD_WITH_METADATA_ERROR;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.openrepo.oaipmh.exception.InvariantViolationException;

/**
 * Record of an item: header plus metadata payload in one format. A deleted record has no metadata.
 * <p>
 * Records are identified by the identifier of their header: two records with the same identifier are equal
 * whatever their payload.
 */
public final class Record {

  private final RecordHeader header;
  private final Map<String, String> metadata;

  public Record(RecordHeader header) {
    this(header, null);
  }

  public Record(RecordHeader header, Map<String, String> metadata) {
    Objects.requireNonNull(header, "header");
    if (header.isDeleted() && metadata != null) {
      throw new InvariantViolationException(DELETED_RECORD_WITH_METADATA_ERROR);
    }
    this.header = header;
    this.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public RecordHeader getHeader() {
    return header;
  }

  /**
   * @return metadata fields keyed by element name, or {@code null} if the record has no metadata
   */
  public Map<String, String> getMetadata() {
    return metadata;
  }

  public boolean isDeleted() {
    return header.isDeleted();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Record)) {
      return false;
    }
    return header.getIdentifier().equals(((Record) o).header.getIdentifier());
  }

  @Override
  public int hashCode() {
    return header.getIdentifier().hashCode();
  }

  @Override
  public String toString() {
    return String.format("Record{identifier=%s, deleted=%s, hasMetadata=%s}",
      header.getIdentifier(), isDeleted(), metadata != null);
  }
}
