package org.openrepo.oaipmh.domain.entity;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.openrepo.oaipmh.domain.value.SetSpec;

/**
 * Set of the repository as listed by ListSets. Identified by its {@link SetSpec}.
 */
public final class OaiSet {

  private final SetSpec setSpec;
  private final String setName;
  private final String setDescription;

  public OaiSet(SetSpec setSpec, String setName) {
    this(setSpec, setName, null);
  }

  public OaiSet(SetSpec setSpec, String setName, String setDescription) {
    this.setSpec = Objects.requireNonNull(setSpec, "setSpec");
    this.setName = Objects.requireNonNull(setName, "setName");
    // an empty description means there is none
    this.setDescription = StringUtils.isEmpty(setDescription) ? null : setDescription;
  }

  public SetSpec getSetSpec() {
    return setSpec;
  }

  public String getSetName() {
    return setName;
  }

  public String getSetDescription() {
    return setDescription;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OaiSet)) {
      return false;
    }
    return setSpec.equals(((OaiSet) o).setSpec);
  }

  @Override
  public int hashCode() {
    return setSpec.hashCode();
  }

  @Override
  public String toString() {
    return "OaiSet{setSpec=" + setSpec + ", setName=" + setName + "}";
  }
}
