package org.openrepo.oaipmh;

import static org.openrepo.oaipmh.Constants.JAXB_MARSHALLER_FORMATTED_OUTPUT;
import static org.openrepo.oaipmh.Constants.OAI_PMH_SCHEMA_LOCATION;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.Marshaller;
import javax.xml.bind.Unmarshaller;

import org.apache.commons.lang3.time.StopWatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.model.OaiPmhResponse;

public class ResponseConverter {

  private static final Logger logger = LogManager.getLogger(ResponseConverter.class);

  private static ResponseConverter ourInstance;

  static {
    try {
      ourInstance = new ResponseConverter();
    } catch (JAXBException e) {
      logger.error("The jaxb context could not be initialized.");
      throw new IllegalStateException("Marshaller and unmarshaller are not available.", e);
    }
  }

  private final JAXBContext jaxbContext;

  public static ResponseConverter getInstance() {
    return ourInstance;
  }

  private ResponseConverter() throws JAXBException {
    jaxbContext = JAXBContext.newInstance(OaiPmhResponse.class);
  }

  /**
   * Marshals {@link OaiPmhResponse} object and returns string representation
   * @param response {@link OaiPmhResponse} object to marshal
   * @return marshaled {@link OaiPmhResponse} object as string representation
   */
  public String convertToString(OaiPmhResponse response) {
    StopWatch timer = StopWatch.createStarted();

    try (StringWriter writer = new StringWriter()) {
      // Marshaller is not thread-safe, so we should create every time a new one
      Marshaller jaxbMarshaller = jaxbContext.createMarshaller();
      jaxbMarshaller.setProperty(Marshaller.JAXB_SCHEMA_LOCATION, OAI_PMH_SCHEMA_LOCATION);
      jaxbMarshaller.setProperty(Marshaller.JAXB_FORMATTED_OUTPUT,
        Boolean.parseBoolean(System.getProperty(JAXB_MARSHALLER_FORMATTED_OUTPUT)));
      jaxbMarshaller.marshal(response, writer);
      return writer.toString();
    } catch (JAXBException | IOException e) {
      // In case there is an issue to marshal response, there is no way to handle it
      throw new IllegalStateException("The OAI-PMH response cannot be converted to string representation.", e);
    } finally {
      logExecutionTime("OAI-PMH response converted to string", timer);
    }
  }

  /**
   * Unmarshals {@link OaiPmhResponse} object based on passed string
   * @param oaipmhResponse the {@link OaiPmhResponse} in string representation
   * @return the {@link OaiPmhResponse} object based on passed string
   */
  public OaiPmhResponse stringToOaiPmh(String oaipmhResponse) {
    StopWatch timer = StopWatch.createStarted();
    try (StringReader reader = new StringReader(oaipmhResponse)) {
      Unmarshaller jaxbUnmarshaller = jaxbContext.createUnmarshaller();
      return (OaiPmhResponse) jaxbUnmarshaller.unmarshal(reader);
    } catch (JAXBException e) {
      throw new IllegalStateException("The string cannot be converted to OAI-PMH response.", e);
    } finally {
      logExecutionTime("String converted to OAI-PMH response", timer);
    }
  }

  private void logExecutionTime(final String msg, StopWatch timer) {
    timer.stop();
    logger.debug("{} after {} ms.", msg, timer.getTime());
  }
}
