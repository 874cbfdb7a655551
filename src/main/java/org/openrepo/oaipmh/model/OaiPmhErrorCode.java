package org.openrepo.oaipmh.model;

import java.util.HashMap;
import java.util.Map;

import javax.xml.bind.annotation.XmlEnum;
import javax.xml.bind.annotation.XmlEnumValue;
import javax.xml.bind.annotation.XmlType;

/**
 * OAI-PMH 2.0 error codes.
 */
@XmlType(name = "OAI-PMHerrorcodeType")
@XmlEnum
public enum OaiPmhErrorCode {

  @XmlEnumValue("badArgument")
  BAD_ARGUMENT("badArgument"),
  @XmlEnumValue("badResumptionToken")
  BAD_RESUMPTION_TOKEN("badResumptionToken"),
  @XmlEnumValue("badVerb")
  BAD_VERB("badVerb"),
  @XmlEnumValue("cannotDisseminateFormat")
  CANNOT_DISSEMINATE_FORMAT("cannotDisseminateFormat"),
  @XmlEnumValue("idDoesNotExist")
  ID_DOES_NOT_EXIST("idDoesNotExist"),
  @XmlEnumValue("noRecordsMatch")
  NO_RECORDS_MATCH("noRecordsMatch"),
  @XmlEnumValue("noMetadataFormats")
  NO_METADATA_FORMATS("noMetadataFormats"),
  @XmlEnumValue("noSetHierarchy")
  NO_SET_HIERARCHY("noSetHierarchy");

  private static final Map<String, OaiPmhErrorCode> CONSTANTS = new HashMap<>();
  static {
    for (OaiPmhErrorCode c : values()) {
      CONSTANTS.put(c.value, c);
    }
  }

  private final String value;

  OaiPmhErrorCode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static OaiPmhErrorCode fromValue(String value) {
    OaiPmhErrorCode code = CONSTANTS.get(value);
    if (code == null) {
      throw new IllegalArgumentException(value);
    }
    return code;
  }

  @Override
  public String toString() {
    return value;
  }
}
