@XmlSchema(namespace = "http://www.openarchives.org/OAI/2.0/",
  elementFormDefault = XmlNsForm.QUALIFIED,
  xmlns = @XmlNs(prefix = "", namespaceURI = "http://www.openarchives.org/OAI/2.0/"))
package org.openrepo.oaipmh.model;

import javax.xml.bind.annotation.XmlNs;
import javax.xml.bind.annotation.XmlNsForm;
import javax.xml.bind.annotation.XmlSchema;
