package org.openrepo.oaipmh.domain.format;

import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.openrepo.oaipmh.exception.ValidationException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Non-empty, ordered group of namespaces declared by one metadata format. Neither a prefix nor a URI may be
 * declared twice.
 * <p>
 * Iteration follows insertion order, but equality does not: two collections declaring the same
 * prefix/URI bindings are equal regardless of order.
 */
public final class MetadataNamespaceCollection implements Iterable<MetadataNamespace> {

  private final List<MetadataNamespace> namespaces;

  public MetadataNamespaceCollection(Collection<MetadataNamespace> namespaces) {
    validate(namespaces);
    this.namespaces = ImmutableList.copyOf(namespaces);
  }

  public static MetadataNamespaceCollection of(MetadataNamespace... namespaces) {
    return new MetadataNamespaceCollection(List.of(namespaces));
  }

  private static void validate(Collection<MetadataNamespace> namespaces) {
    if (namespaces == null || namespaces.isEmpty()) {
      throw ValidationException.emptyCollection("namespace");
    }
    Set<String> prefixes = new HashSet<>();
    Set<String> uris = new HashSet<>();
    for (MetadataNamespace namespace : namespaces) {
      String prefix = namespace.getPrefix().getValue();
      if (!prefixes.add(prefix)) {
        throw ValidationException.duplicateValue("namespace prefix", prefix);
      }
      String uri = namespace.getUri().getValue();
      if (!uris.add(uri)) {
        throw ValidationException.duplicateValue("namespace uri", uri);
      }
    }
  }

  public List<MetadataNamespace> getNamespaces() {
    return namespaces;
  }

  public int size() {
    return namespaces.size();
  }

  @Override
  public Iterator<MetadataNamespace> iterator() {
    return namespaces.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataNamespaceCollection)) {
      return false;
    }
    MetadataNamespaceCollection that = (MetadataNamespaceCollection) o;
    return namespaces.size() == that.namespaces.size()
      && ImmutableSet.copyOf(namespaces).equals(ImmutableSet.copyOf(that.namespaces));
  }

  @Override
  public int hashCode() {
    return new HashSet<>(namespaces).hashCode();
  }

  @Override
  public String toString() {
    return namespaces.toString();
  }
}
