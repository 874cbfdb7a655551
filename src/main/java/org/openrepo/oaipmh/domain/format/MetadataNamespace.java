package org.openrepo.oaipmh.domain.format;

import java.util.Objects;

import org.openrepo.oaipmh.domain.value.AnyUri;
import org.openrepo.oaipmh.domain.value.NamespacePrefix;

/**
 * XML namespace declared by a metadata format: prefix bound to a namespace URI.
 */
public final class MetadataNamespace {

  private final NamespacePrefix prefix;
  private final AnyUri uri;

  public MetadataNamespace(NamespacePrefix prefix, AnyUri uri) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.uri = Objects.requireNonNull(uri, "uri");
  }

  public NamespacePrefix getPrefix() {
    return prefix;
  }

  public AnyUri getUri() {
    return uri;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataNamespace)) {
      return false;
    }
    MetadataNamespace that = (MetadataNamespace) o;
    return prefix.equals(that.prefix) && uri.equals(that.uri);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prefix, uri);
  }

  @Override
  public String toString() {
    return "xmlns:" + prefix + "=\"" + uri + "\"";
  }
}
