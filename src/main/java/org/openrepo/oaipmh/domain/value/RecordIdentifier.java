package org.openrepo.oaipmh.domain.value;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Unique identifier of an item in the repository, e.g. {@code oai:arXiv.org:cs/0112017}. Opaque to the
 * protocol; only blank values are rejected.
 */
public final class RecordIdentifier {

  private final String identifier;

  public RecordIdentifier(String identifier) {
    if (StringUtils.isBlank(identifier)) {
      throw ValidationException.invalidFormat("identifier", identifier);
    }
    this.identifier = identifier;
  }

  public String getValue() {
    return identifier;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordIdentifier)) {
      return false;
    }
    return identifier.equals(((RecordIdentifier) o).identifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(identifier);
  }

  @Override
  public String toString() {
    return identifier;
  }
}
