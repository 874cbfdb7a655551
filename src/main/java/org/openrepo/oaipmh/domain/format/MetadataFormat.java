package org.openrepo.oaipmh.domain.format;

import java.util.Objects;

import org.openrepo.oaipmh.domain.value.AnyUri;
import org.openrepo.oaipmh.domain.value.MetadataPrefix;
import org.openrepo.oaipmh.domain.value.MetadataRootTag;

/**
 * Metadata format a repository can disseminate, as listed by ListMetadataFormats. Looked up by its
 * {@link MetadataPrefix}; two formats are equal only when all four components are.
 */
public final class MetadataFormat {

  private final MetadataPrefix metadataPrefix;
  private final MetadataNamespaceCollection namespaces;
  private final AnyUri schema;
  private final MetadataRootTag rootTag;

  public MetadataFormat(MetadataPrefix metadataPrefix, MetadataNamespaceCollection namespaces, AnyUri schema,
      MetadataRootTag rootTag) {
    this.metadataPrefix = Objects.requireNonNull(metadataPrefix, "metadataPrefix");
    this.namespaces = Objects.requireNonNull(namespaces, "namespaces");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.rootTag = Objects.requireNonNull(rootTag, "rootTag");
  }

  public MetadataPrefix getMetadataPrefix() {
    return metadataPrefix;
  }

  public MetadataNamespaceCollection getNamespaces() {
    return namespaces;
  }

  public AnyUri getSchema() {
    return schema;
  }

  public MetadataRootTag getRootTag() {
    return rootTag;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataFormat)) {
      return false;
    }
    MetadataFormat that = (MetadataFormat) o;
    return metadataPrefix.equals(that.metadataPrefix)
      && namespaces.equals(that.namespaces)
      && schema.equals(that.schema)
      && rootTag.equals(that.rootTag);
  }

  @Override
  public int hashCode() {
    return Objects.hash(metadataPrefix, namespaces, schema, rootTag);
  }

  @Override
  public String toString() {
    return "MetadataFormat{metadataPrefix=" + metadataPrefix + ", schema=" + schema + ", rootTag=" + rootTag + "}";
  }
}
