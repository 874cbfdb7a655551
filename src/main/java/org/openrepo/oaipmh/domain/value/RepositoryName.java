package org.openrepo.oaipmh.domain.value;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Human readable name of the repository. Must not be blank.
 */
public final class RepositoryName {

  private final String value;

  public RepositoryName(String value) {
    if (StringUtils.isBlank(value)) {
      throw ValidationException.invalidFormat("repositoryName", value);
    }
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RepositoryName)) {
      return false;
    }
    return value.equals(((RepositoryName) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
