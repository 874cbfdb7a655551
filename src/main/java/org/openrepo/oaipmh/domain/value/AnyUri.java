package org.openrepo.oaipmh.domain.value;

import static javax.xml.XMLConstants.W3C_XML_SCHEMA_NS_URI;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.exception.ValidationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * URI conforming to the XML Schema {@code anyURI} type.
 * <p>
 * The value is checked by the JDK schema validator against {@code schemas/anyURI.xsd}: a document with a single
 * {@code uri} element holding the value as text content is built and validated. Text content is escaped by the
 * DOM, so the value cannot inject markup.
 */
public final class AnyUri {

  private static final Logger logger = LogManager.getLogger(AnyUri.class);

  private static final String ANY_URI_SCHEMA = "schemas/anyURI.xsd";
  private static final String ROOT_ELEMENT = "root";
  private static final String URI_ELEMENT = "uri";

  private static final Schema schema;
  private static final DocumentBuilderFactory documentBuilderFactory = DocumentBuilderFactory.newInstance();

  static {
    try (InputStream xsd = AnyUri.class.getClassLoader().getResourceAsStream(ANY_URI_SCHEMA)) {
      if (xsd == null) {
        throw new IllegalStateException("Schema resource is missing: " + ANY_URI_SCHEMA);
      }
      schema = SchemaFactory.newInstance(W3C_XML_SCHEMA_NS_URI).newSchema(new StreamSource(xsd));
    } catch (SAXException | IOException e) {
      logger.error("The anyURI schema could not be loaded.");
      throw new IllegalStateException("anyURI validation is not available.", e);
    }
  }

  private final String uri;

  public AnyUri(String uri) {
    validate(uri);
    this.uri = uri;
  }

  public String getValue() {
    return uri;
  }

  private static void validate(String uri) {
    if (uri == null) {
      throw ValidationException.invalidFormat(URI_ELEMENT, null);
    }
    try {
      Document document = newDocument();
      Element root = document.createElementNS(null, ROOT_ELEMENT);
      Element uriElement = document.createElementNS(null, URI_ELEMENT);
      uriElement.setTextContent(uri);
      root.appendChild(uriElement);
      document.appendChild(root);

      // Validator is not thread-safe, so we should create every time a new one
      Validator validator = schema.newValidator();
      validator.validate(new DOMSource(document));
    } catch (SAXException e) {
      logger.debug("Value '{}' is not an anyURI: {}", uri, e.getMessage());
      throw ValidationException.invalidFormat(URI_ELEMENT, uri);
    } catch (IOException e) {
      throw new IllegalStateException("The anyURI value cannot be validated.", e);
    }
  }

  // DocumentBuilderFactory is not thread-safe
  private static synchronized Document newDocument() {
    try {
      return documentBuilderFactory.newDocumentBuilder().newDocument();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML document builder is not available.", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AnyUri)) {
      return false;
    }
    return uri.equals(((AnyUri) o).uri);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri);
  }

  @Override
  public String toString() {
    return uri;
  }
}
