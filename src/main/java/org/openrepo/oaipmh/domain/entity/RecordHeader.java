package org.openrepo.oaipmh.domain.entity;

import java.util.List;
import java.util.Objects;

import org.openrepo.oaipmh.domain.value.RecordIdentifier;
import org.openrepo.oaipmh.domain.value.SetSpec;
import org.openrepo.oaipmh.domain.value.UtcDatetime;

import com.google.common.collect.ImmutableList;

/**
 * Header of a record: identifier, datestamp, deletion status and set membership.
 */
public final class RecordHeader {

  private final RecordIdentifier identifier;
  private final UtcDatetime datestamp;
  private final boolean deleted;
  private final List<SetSpec> setSpecs;

  public RecordHeader(RecordIdentifier identifier, UtcDatetime datestamp) {
    this(identifier, datestamp, false, List.of());
  }

  /**
   * @param identifier unique identifier of the item
   * @param datestamp  date of creation, modification or deletion of the record
   * @param deleted    whether the record is marked as deleted
   * @param setSpecs   sets the record belongs to, in the order they should be listed
   * @throws NullPointerException if any argument or any set spec is {@code null}
   */
  public RecordHeader(RecordIdentifier identifier, UtcDatetime datestamp, boolean deleted, List<SetSpec> setSpecs) {
    this.identifier = Objects.requireNonNull(identifier, "identifier");
    this.datestamp = Objects.requireNonNull(datestamp, "datestamp");
    this.deleted = deleted;
    this.setSpecs = ImmutableList.copyOf(Objects.requireNonNull(setSpecs, "setSpecs"));
  }

  public RecordIdentifier getIdentifier() {
    return identifier;
  }

  public UtcDatetime getDatestamp() {
    return datestamp;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public List<SetSpec> getSetSpecs() {
    return setSpecs;
  }

  public boolean belongsToSet(SetSpec setSpec) {
    return setSpecs.contains(setSpec);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordHeader)) {
      return false;
    }
    RecordHeader that = (RecordHeader) o;
    return deleted == that.deleted
      && identifier.equals(that.identifier)
      && datestamp.equals(that.datestamp)
      && setSpecs.equals(that.setSpecs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier, datestamp, deleted, setSpecs);
  }

  @Override
  public String toString() {
    return String.format("RecordHeader{identifier=%s, datestamp=%s, deleted=%s, sets=%d}",
      identifier, datestamp, deleted, setSpecs.size());
  }
}
