package org.openrepo.oaipmh.model;

import java.util.Objects;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlType;
import javax.xml.bind.annotation.XmlValue;

/**
 * The {@code <request>} element: base URL as text, the request arguments as attributes.
 */
@XmlAccessorType(XmlAccessType.FIELD)
@XmlType(name = "requestType")
public class RequestType {

  @XmlValue
  private String value;
  @XmlAttribute(name = "verb")
  private String verb;
  @XmlAttribute(name = "identifier")
  private String identifier;
  @XmlAttribute(name = "metadataPrefix")
  private String metadataPrefix;
  @XmlAttribute(name = "from")
  private String from;
  @XmlAttribute(name = "until")
  private String until;
  @XmlAttribute(name = "set")
  private String set;
  @XmlAttribute(name = "resumptionToken")
  private String resumptionToken;

  public String getValue() {
    return value;
  }

  public String getVerb() {
    return verb;
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getMetadataPrefix() {
    return metadataPrefix;
  }

  public String getFrom() {
    return from;
  }

  public String getUntil() {
    return until;
  }

  public String getSet() {
    return set;
  }

  public String getResumptionToken() {
    return resumptionToken;
  }

  public RequestType withValue(String value) {
    this.value = value;
    return this;
  }

  public RequestType withVerb(String verb) {
    this.verb = verb;
    return this;
  }

  public RequestType withIdentifier(String identifier) {
    this.identifier = identifier;
    return this;
  }

  public RequestType withMetadataPrefix(String metadataPrefix) {
    this.metadataPrefix = metadataPrefix;
    return this;
  }

  public RequestType withFrom(String from) {
    this.from = from;
    return this;
  }

  public RequestType withUntil(String until) {
    this.until = until;
    return this;
  }

  public RequestType withSet(String set) {
    this.set = set;
    return this;
  }

  public RequestType withResumptionToken(String resumptionToken) {
    this.resumptionToken = resumptionToken;
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
    RequestType that = (RequestType) o;
    return Objects.equals(value, that.value)
      && Objects.equals(verb, that.verb)
      && Objects.equals(identifier, that.identifier)
      && Objects.equals(metadataPrefix, that.metadataPrefix)
      && Objects.equals(from, that.from)
      && Objects.equals(until, that.until)
      && Objects.equals(set, that.set)
      && Objects.equals(resumptionToken, that.resumptionToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, verb, identifier, metadataPrefix, from, until, set, resumptionToken);
  }
}
