package org.openrepo.oaipmh.model;

import java.util.Objects;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlType;
import javax.xml.bind.annotation.XmlValue;

/**
 * One {@code <error code="...">message</error>} element of the response.
 */
@XmlAccessorType(XmlAccessType.FIELD)
@XmlType(name = "OAI-PMHerrorType")
public class OaiPmhError {

  @XmlValue
  private String value;
  @XmlAttribute(name = "code", required = true)
  private OaiPmhErrorCode code;

  public String getValue() {
    return value;
  }

  public OaiPmhErrorCode getCode() {
    return code;
  }

  public OaiPmhError withValue(String value) {
    this.value = value;
    return this;
  }

  public OaiPmhError withCode(OaiPmhErrorCode code) {
    this.code = code;
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    OaiPmhError that = (OaiPmhError) o;
    return Objects.equals(value, that.value) && code == that.code;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, code);
  }

  @Override
  public String toString() {
    return code + ": " + value;
  }
}
