package org.openrepo.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.openrepo.oaipmh.domain.Granularity;
import org.openrepo.oaipmh.helpers.configuration.RepositoryConfiguration;
import org.openrepo.oaipmh.processors.OaiPmhRequestProcessor;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

class ApplicationConfigTest {

  private static AnnotationConfigApplicationContext context;

  @BeforeAll
  static void setUpContext() {
    System.setProperty("repository.name", "Overridden repository");
    context = new AnnotationConfigApplicationContext(ApplicationConfig.class);
  }

  @AfterAll
  static void tearDownContext() {
    context.close();
    System.clearProperty("repository.name");
  }

  @Test
  void shouldReadRepositorySettings() {
    RepositoryConfiguration configuration = context.getBean(RepositoryConfiguration.class);

    assertThat(configuration.getBaseUrl().getValue(), is("http://localhost:8081/oai"));
    assertThat(configuration.getTimeGranularity(), is(Granularity.YYYY_MM_DD_THH_MM_SS_Z));
    assertThat(configuration.getRepositoryName().getValue(), is("Overridden repository"));
  }

  @Test
  void shouldAnswerIdentify() {
    String xml = context.getBean(OaiPmhRequestProcessor.class).process("verb=Identify");

    assertThat(xml, containsString("<request verb=\"Identify\">http://localhost:8081/oai</request>"));
    assertThat(xml, containsString("<repositoryName>Overridden repository</repositoryName>"));
    assertThat(xml, containsString("<protocolVersion>2.0</protocolVersion>"));
    assertThat(xml, containsString("<adminEmail>oai-pmh@example.org</adminEmail>"));
    assertThat(xml, containsString("<deletedRecord>persistent</deletedRecord>"));
    assertThat(xml, containsString("<granularity>YYYY-MM-DDThh:mm:ssZ</granularity>"));
  }

  @Test
  void shouldAnswerProtocolErrors() {
    String xml = context.getBean(OaiPmhRequestProcessor.class).process("verb=ListRecords&metadataPrefix=oai_dc");

    assertThat(xml, containsString("<error code=\"badVerb\">The verb 'ListRecords' is not supported by this repository</error>"));
  }
}
