package org.openrepo.oaipmh.domain.value;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.openrepo.oaipmh.exception.ValidationException;

import com.google.common.collect.ImmutableSet;

/**
 * Absolute http or https URL the repository answers OAI-PMH requests on.
 */
public final class BaseUrl {

  private static final String FIELD = "baseURL";
  private static final ImmutableSet<String> SCHEMES = ImmutableSet.of("http", "https");

  private final AnyUri uri;

  public BaseUrl(String value) {
    this.uri = new AnyUri(value);
    validate(value);
  }

  private static void validate(String value) {
    try {
      URI parsed = new URI(value);
      String scheme = StringUtils.lowerCase(parsed.getScheme());
      if (!SCHEMES.contains(scheme) || StringUtils.isEmpty(parsed.getHost())) {
        throw ValidationException.invalidFormat(FIELD, value);
      }
    } catch (URISyntaxException e) {
      throw ValidationException.invalidFormat(FIELD, value);
    }
  }

  public String getValue() {
    return uri.getValue();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BaseUrl)) {
      return false;
    }
    return uri.equals(((BaseUrl) o).uri);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri);
  }

  @Override
  public String toString() {
    return uri.toString();
  }
}
