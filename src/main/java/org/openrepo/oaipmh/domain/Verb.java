package org.openrepo.oaipmh.domain;

import static org.openrepo.oaipmh.Constants.FROM_PARAM;
import static org.openrepo.oaipmh.Constants.IDENTIFIER_PARAM;
import static org.openrepo.oaipmh.Constants.METADATA_PREFIX_PARAM;
import static org.openrepo.oaipmh.Constants.RESUMPTION_TOKEN_PARAM;
import static org.openrepo.oaipmh.Constants.SET_PARAM;
import static org.openrepo.oaipmh.Constants.UNTIL_PARAM;
import static org.openrepo.oaipmh.Constants.VERB_PARAM;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Enum that represents OAI-PMH verbs with associated http parameters.
 */
public enum Verb {
  GET_RECORD("GetRecord", ImmutableSet.of(IDENTIFIER_PARAM, METADATA_PREFIX_PARAM), ImmutableSet.of(), null),
  IDENTIFY("Identify", ImmutableSet.of(), ImmutableSet.of(), null),
  LIST_IDENTIFIERS("ListIdentifiers", ImmutableSet.of(METADATA_PREFIX_PARAM),
    ImmutableSet.of(FROM_PARAM, UNTIL_PARAM, SET_PARAM), RESUMPTION_TOKEN_PARAM),
  LIST_METADATA_FORMATS("ListMetadataFormats", ImmutableSet.of(), ImmutableSet.of(IDENTIFIER_PARAM), null),
  LIST_RECORDS("ListRecords", ImmutableSet.of(METADATA_PREFIX_PARAM),
    ImmutableSet.of(FROM_PARAM, UNTIL_PARAM, SET_PARAM), RESUMPTION_TOKEN_PARAM),
  LIST_SETS("ListSets", ImmutableSet.of(), ImmutableSet.of(), RESUMPTION_TOKEN_PARAM);

  /** String name of the verb. */
  private final String name;
  /** Required http parameters associated with the verb. */
  private final Set<String> requiredParams;
  /** Optional http parameters associated with the verb. */
  private final Set<String> optionalParams;
  /** Exclusive (i.e. must be the only one if provided) http parameter associated with the verb. */
  private final String exclusiveParam;
  /** All possible parameters associated with the verb, including the verb itself. */
  private final Set<String> allParams;

  private static final Map<String, Verb> CONSTANTS = new HashMap<>();
  static {
    for (Verb v : values()) {
      CONSTANTS.put(v.name, v);
    }
  }

  Verb(String name, Set<String> requiredParams, Set<String> optionalParams, String exclusiveParam) {
    this.name = name;
    this.requiredParams = requiredParams;
    this.optionalParams = optionalParams;
    this.exclusiveParam = exclusiveParam;

    ImmutableSet.Builder<String> params = ImmutableSet.<String>builder()
      .add(VERB_PARAM)
      .addAll(requiredParams)
      .addAll(optionalParams);
    if (exclusiveParam != null) {
      params.add(exclusiveParam);
    }
    this.allParams = params.build();
  }

  /**
   * Looks the verb up by its protocol name, e.g. {@code ListRecords}.
   *
   * @param name protocol name of the verb
   * @return the verb or {@code null} if the name is not an OAI-PMH verb
   */
  public static Verb fromName(String name) {
    return CONSTANTS.get(name);
  }

  public String getName() {
    return name;
  }

  public Set<String> getRequiredParams() {
    return requiredParams;
  }

  public Set<String> getOptionalParams() {
    return optionalParams;
  }

  public String getExclusiveParam() {
    return exclusiveParam;
  }

  public Set<String> getAllParams() {
    return allParams;
  }

  @Override
  public String toString() {
    return this.name;
  }
}
