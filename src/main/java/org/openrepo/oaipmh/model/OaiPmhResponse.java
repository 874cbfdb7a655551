package org.openrepo.oaipmh.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlRootElement;
import javax.xml.bind.annotation.XmlType;
import javax.xml.bind.annotation.adapters.XmlJavaTypeAdapter;

/**
 * Root {@code <OAI-PMH>} element. Holds either a list of errors or the verb specific payload.
 */
@XmlAccessorType(XmlAccessType.FIELD)
@XmlType(name = "", propOrder = {
  "responseDate",
  "request",
  "errors",
  "identify"
})
@XmlRootElement(name = "OAI-PMH")
public class OaiPmhResponse {

  @XmlElement(required = true)
  @XmlJavaTypeAdapter(InstantAdapter.class)
  private Instant responseDate;
  @XmlElement(required = true)
  private RequestType request;
  @XmlElement(name = "error")
  private List<OaiPmhError> errors = new ArrayList<>();
  @XmlElement(name = "Identify")
  private IdentifyType identify;

  public Instant getResponseDate() {
    return responseDate;
  }

  public RequestType getRequest() {
    return request;
  }

  public List<OaiPmhError> getErrors() {
    return errors;
  }

  public IdentifyType getIdentify() {
    return identify;
  }

  public OaiPmhResponse withResponseDate(Instant responseDate) {
    this.responseDate = responseDate;
    return this;
  }

  public OaiPmhResponse withRequest(RequestType request) {
    this.request = request;
    return this;
  }

  public OaiPmhResponse withErrors(Collection<OaiPmhError> errors) {
    this.errors.addAll(errors);
    return this;
  }

  public OaiPmhResponse withErrors(OaiPmhError... errors) {
    return withErrors(List.of(errors));
  }

  public OaiPmhResponse withIdentify(IdentifyType identify) {
    this.identify = identify;
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
    OaiPmhResponse that = (OaiPmhResponse) o;
    return Objects.equals(responseDate, that.responseDate)
      && Objects.equals(request, that.request)
      && Objects.equals(errors, that.errors)
      && Objects.equals(identify, that.identify);
  }

  @Override
  public int hashCode() {
    return Objects.hash(responseDate, request, errors, identify);
  }
}
