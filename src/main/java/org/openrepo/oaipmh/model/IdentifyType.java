package org.openrepo.oaipmh.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlType;

@XmlAccessorType(XmlAccessType.FIELD)
@XmlType(name = "IdentifyType", propOrder = {
  "repositoryName",
  "baseURL",
  "protocolVersion",
  "adminEmails",
  "earliestDatestamp",
  "deletedRecord",
  "granularity"
})
public class IdentifyType {

  @XmlElement(required = true)
  private String repositoryName;
  @XmlElement(required = true)
  private String baseURL;
  @XmlElement(required = true)
  private String protocolVersion;
  @XmlElement(name = "adminEmail", required = true)
  private List<String> adminEmails = new ArrayList<>();
  @XmlElement(required = true)
  private String earliestDatestamp;
  @XmlElement(required = true)
  private String deletedRecord;
  @XmlElement(required = true)
  private String granularity;

  public String getRepositoryName() {
    return repositoryName;
  }

  public String getBaseURL() {
    return baseURL;
  }

  public String getProtocolVersion() {
    return protocolVersion;
  }

  public List<String> getAdminEmails() {
    return adminEmails;
  }

  public String getEarliestDatestamp() {
    return earliestDatestamp;
  }

  public String getDeletedRecord() {
    return deletedRecord;
  }

  public String getGranularity() {
    return granularity;
  }

  public IdentifyType withRepositoryName(String repositoryName) {
    this.repositoryName = repositoryName;
    return this;
  }

  public IdentifyType withBaseURL(String baseURL) {
    this.baseURL = baseURL;
    return this;
  }

  public IdentifyType withProtocolVersion(String protocolVersion) {
    this.protocolVersion = protocolVersion;
    return this;
  }

  public IdentifyType withAdminEmails(String... adminEmails) {
    this.adminEmails.addAll(Arrays.asList(adminEmails));
    return this;
  }

  public IdentifyType withAdminEmails(Collection<String> adminEmails) {
    this.adminEmails.addAll(adminEmails);
    return this;
  }

  public IdentifyType withEarliestDatestamp(String earliestDatestamp) {
    this.earliestDatestamp = earliestDatestamp;
    return this;
  }

  public IdentifyType withDeletedRecord(String deletedRecord) {
    this.deletedRecord = deletedRecord;
    return this;
  }

  public IdentifyType withGranularity(String granularity) {
    this.granularity = granularity;
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
    IdentifyType that = (IdentifyType) o;
    return Objects.equals(repositoryName, that.repositoryName)
      && Objects.equals(baseURL, that.baseURL)
      && Objects.equals(protocolVersion, that.protocolVersion)
      && Objects.equals(adminEmails, that.adminEmails)
      && Objects.equals(earliestDatestamp, that.earliestDatestamp)
      && Objects.equals(deletedRecord, that.deletedRecord)
      && Objects.equals(granularity, that.granularity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(repositoryName, baseURL, protocolVersion, adminEmails, earliestDatestamp, deletedRecord,
      granularity);
  }
}
