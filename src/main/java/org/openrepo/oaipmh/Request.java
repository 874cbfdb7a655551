package org.openrepo.oaipmh;

import java.util.Objects;

import org.openrepo.oaipmh.domain.Verb;

/**
 * Class that represents a validated OAI-PMH request and holds its http query arguments.
 * It implements builder pattern, so use {@link Builder} instance to build an instance of the request.
 * Instances are immutable.
 */
public final class Request {

  private final Verb verb;
  private final String identifier;
  private final String metadataPrefix;
  private final String from;
  private final String until;
  private final String set;
  private final String resumptionToken;

  /**
   * Builder used to build the request.
   */
  public static class Builder {
    private Verb verb;
    private String identifier;
    private String metadataPrefix;
    private String from;
    private String until;
    private String set;
    private String resumptionToken;

    public Builder verb(Verb verb) {
      this.verb = verb;
      return this;
    }

    public Builder metadataPrefix(String metadataPrefix) {
      this.metadataPrefix = metadataPrefix;
      return this;
    }

    public Builder identifier(String identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder from(String from) {
      this.from = from;
      return this;
    }

    public Builder until(String until) {
      this.until = until;
      return this;
    }

    public Builder set(String set) {
      this.set = set;
      return this;
    }

    public Builder resumptionToken(String resumptionToken) {
      this.resumptionToken = resumptionToken;
      return this;
    }

    public Request build() {
      return new Request(this);
    }
  }

  private Request(Builder builder) {
    this.verb = Objects.requireNonNull(builder.verb, "verb");
    this.identifier = builder.identifier;
    this.metadataPrefix = builder.metadataPrefix;
    this.from = builder.from;
    this.until = builder.until;
    this.set = builder.set;
    this.resumptionToken = builder.resumptionToken;
  }

  /**
   * Factory method returning an instance of the builder.
   * @return {@link Builder} instance
   */
  public static Builder builder() {
    return new Builder();
  }

  public Verb getVerb() {
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

  /**
   * Returns the value of the named argument as it was given in the query.
   *
   * @param param argument name, e.g. {@link Constants#FROM_PARAM}
   * @return the value or {@code null} if the argument was not given
   */
  public String getParam(String param) {
    switch (param) {
      case Constants.VERB_PARAM:
        return verb.getName();
      case Constants.IDENTIFIER_PARAM:
        return identifier;
      case Constants.METADATA_PREFIX_PARAM:
        return metadataPrefix;
      case Constants.FROM_PARAM:
        return from;
      case Constants.UNTIL_PARAM:
        return until;
      case Constants.SET_PARAM:
        return set;
      case Constants.RESUMPTION_TOKEN_PARAM:
        return resumptionToken;
      default:
        return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Request)) {
      return false;
    }
    Request that = (Request) o;
    return verb == that.verb
      && Objects.equals(identifier, that.identifier)
      && Objects.equals(metadataPrefix, that.metadataPrefix)
      && Objects.equals(from, that.from)
      && Objects.equals(until, that.until)
      && Objects.equals(set, that.set)
      && Objects.equals(resumptionToken, that.resumptionToken);
  }

  @Override
  public int hashCode() {
    return Objects.hash(verb, identifier, metadataPrefix, from, until, set, resumptionToken);
  }

  @Override
  public String toString() {
    return "Request{verb=" + verb + ", metadataPrefix=" + metadataPrefix + ", identifier=" + identifier
      + ", from=" + from + ", until=" + until + ", set=" + set + ", resumptionToken=" + resumptionToken + "}";
  }
}
