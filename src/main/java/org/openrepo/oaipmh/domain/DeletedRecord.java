package org.openrepo.oaipmh.domain;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * The repository's level of support for deleted records, as announced by Identify.
 */
public enum DeletedRecord {
  NO("no"),
  TRANSIENT("transient"),
  PERSISTENT("persistent");

  private final String value;

  DeletedRecord(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static DeletedRecord fromValue(String value) {
    for (DeletedRecord deletedRecord : values()) {
      if (deletedRecord.value.equals(value)) {
        return deletedRecord;
      }
    }
    throw ValidationException.invalidFormat("deletedRecord", value);
  }

  @Override
  public String toString() {
    return value;
  }
}
