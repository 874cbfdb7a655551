package org.openrepo.oaipmh.domain.value;

import java.util.Objects;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Name of the root element of a metadata record, optionally qualified: {@code oai_dc:dc}.
 */
public final class MetadataRootTag {

  private static final Pattern PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.-]*(:[A-Za-z_][A-Za-z0-9_.-]*)?$");

  private final String value;

  public MetadataRootTag(String value) {
    if (value == null || !PATTERN.matcher(value).matches()) {
      throw ValidationException.invalidFormat("metadataRootTag", value);
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
    if (!(o instanceof MetadataRootTag)) {
      return false;
    }
    return value.equals(((MetadataRootTag) o).value);
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
