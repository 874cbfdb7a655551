package org.openrepo.oaipmh.helpers;

import org.openrepo.oaipmh.Request;
import org.openrepo.oaipmh.domain.Verb;
import org.openrepo.oaipmh.model.OaiPmhResponse;

/**
 * Interface for all OAI-PMH verbs business logic implementations.
 */
public interface VerbHelper {

  /**
   * @return the verb handled by the implementation
   */
  Verb getVerb();

  /**
   * Performs verb specific business logic.
   *
   * @param request the validated OAI-PMH request
   * @return OAI-PMH response
   * @throws org.openrepo.oaipmh.exception.OaiPmhException if the request cannot be answered with data, e.g.
   *                                                      idDoesNotExist
   */
  OaiPmhResponse handle(Request request);
}
