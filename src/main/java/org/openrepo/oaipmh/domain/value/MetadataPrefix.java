package org.openrepo.oaipmh.domain.value;

import java.util.Objects;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Short name of a metadata format as used in the {@code metadataPrefix} argument. Allowed characters are the
 * unreserved characters of RFC 2396.
 */
public final class MetadataPrefix {

  private static final Pattern PATTERN = Pattern.compile("^[A-Za-z0-9\\-_.!~*'()]+$");

  private final String value;

  public MetadataPrefix(String value) {
    if (value == null || !PATTERN.matcher(value).matches()) {
      throw ValidationException.invalidFormat("metadataPrefix", value);
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
    if (!(o instanceof MetadataPrefix)) {
      return false;
    }
    return value.equals(((MetadataPrefix) o).value);
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
