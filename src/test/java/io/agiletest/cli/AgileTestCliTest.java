package io.agiletest.cli;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgileTestCliTest {
  private MockWebServer server;
  private AgileTestCli cli;
  private CommandLine cmd;
  private StringWriter out;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();

    cli = new AgileTestCli();
    cli.environment = Map.of(
        "AGILETEST_BASE_URL", server.url("/").toString(),
        "AGILETEST_DATA_CENTER", "true",
        "AGILETEST_DC_TOKEN", "dc-token",
        "AGILETEST_TIMEOUT", "5");
    cmd = new CommandLine(cli);
    out = new StringWriter();
    cmd.setOut(new PrintWriter(out));
    cmd.setErr(new PrintWriter(new StringWriter()));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void import_printsResponseAndExitsZero(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("TEST-suite.xml");
    Files.writeString(report, "<testsuite/>");
    server.enqueue(new MockResponse().setResponseCode(200)
        .setBody("{\"key\":\"TC-1\",\"url\":\"https://x/TC-1\",\"missedCases\":[]}"));

    int exit = cmd.execute("test-execution", "import", "-t", "junit", "-p", "TC", "-te", "TC-1", report.toString());

    assertEquals(0, exit);
    assertTrue(out.toString().contains("\"key\" : \"TC-1\""));
    RecordedRequest request = server.takeRequest();
    assertEquals("/rest/agiletest/1.0/test-executions/automation/junit?projectKey=TC&testExecutionKey=TC-1",
        request.getPath());
    assertEquals("<testsuite/>", request.getBody().readUtf8());
  }

  @Test
  void importMultipart_sendsBothFiles(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("cucumber.json");
    Path info = dir.resolve("info.json");
    Files.writeString(report, "[]");
    Files.writeString(info, "{\"fields\":{}}");
    server.enqueue(new MockResponse().setResponseCode(200)
        .setBody("{\"key\":\"TC-2\",\"url\":\"https://x/TC-2\"}"));

    int exit = cmd.execute("test-execution", "import-multipart", "-t", "cucumber", report.toString(), info.toString());

    assertEquals(0, exit);
    RecordedRequest request = server.takeRequest();
    assertEquals("/plugins/servlet/agiletest/automation/multipart/cucumber", request.getPath());
  }

  @Test
  void failedUpload_exitsOne(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("TEST-suite.xml");
    Files.writeString(report, "<testsuite/>");
    server.enqueue(new MockResponse().setResponseCode(500).setBody("err"));

    assertEquals(1, cmd.execute("test-execution", "import", "-t", "junit", "-p", "TC", report.toString()));
    assertEquals("", out.toString());
  }

  @Test
  void unsupportedFramework_exitsOneWithoutRequest(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("report.txt");
    Files.writeString(report, "ok");

    assertEquals(1, cmd.execute("test-execution", "import", "-t", "mocha", "-p", "TC", report.toString()));
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void missingSubcommand_isUsageError() {
    assertEquals(2, cmd.execute());
    assertEquals(2, cmd.execute("test-execution"));
  }

  @Test
  void longOptionNamesAreAccepted(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("TEST-suite.xml");
    Files.writeString(report, "<testsuite/>");
    server.enqueue(new MockResponse().setResponseCode(200)
        .setBody("{\"key\":\"TC-3\",\"url\":\"https://x/TC-3\"}"));

    int exit = cmd.execute("test-execution", "import", "--framework-type", "junit", "--project-key", "TC",
        "--test-execution-key", "TC-3", report.toString());

    assertEquals(0, exit);
    assertEquals("/rest/agiletest/1.0/test-executions/automation/junit?projectKey=TC&testExecutionKey=TC-3",
        server.takeRequest().getPath());
  }

  @Test
  void logLevelNamesMapToSimpleLoggerLevels() {
    assertEquals("debug", AgileTestCli.simpleLoggerLevel("DEBUG"));
    assertEquals("debug", AgileTestCli.simpleLoggerLevel("10"));
    assertEquals("info", AgileTestCli.simpleLoggerLevel("info"));
    assertEquals("warn", AgileTestCli.simpleLoggerLevel("WARNING"));
    assertEquals("error", AgileTestCli.simpleLoggerLevel("CRITICAL"));
    assertEquals("error", AgileTestCli.simpleLoggerLevel("40"));
    assertNull(AgileTestCli.simpleLoggerLevel("verbose"));
    assertNull(AgileTestCli.simpleLoggerLevel(" "));
    assertNull(AgileTestCli.simpleLoggerLevel(null));
  }

  @Test
  void logLevelFromEnvironmentSetsDefaultLevel() {
    String previous = System.clearProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL);
    try {
      AgileTestCli.applyLogLevel(Map.of("LOG_LEVEL", "DEBUG"));
      assertEquals("debug", System.getProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL));

      AgileTestCli.applyLogLevel(Map.of("LOG_LEVEL", "ERROR"));
      assertEquals("debug", System.getProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL),
          "an explicit level is not overwritten");
    } finally {
      System.clearProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL);
      if (previous != null) {
        System.setProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL, previous);
      }
    }
  }

  @Test
  void unknownLogLevelLeavesDefault() {
    String previous = System.clearProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL);
    try {
      AgileTestCli.applyLogLevel(Map.of("LOG_LEVEL", "chatty"));
      assertNull(System.getProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL));
    } finally {
      if (previous != null) {
        System.setProperty(AgileTestCli.SIMPLE_LOGGER_LEVEL, previous);
      }
    }
  }

  @Test
  void globalOptionsOverrideEnvironment() {
    cmd.parseArgs("--data-center=false", "--client-id", "id", "--client-secret", "secret",
        "--timeout", "9", "--base-url", "https://cloud.example.com");

    AgileTestConfig config = cli.resolveConfig();

    assertFalse(config.dataCenter());
    assertEquals("id", config.clientId());
    assertEquals("secret", config.clientSecret());
    assertEquals(Duration.ofSeconds(9), config.timeout());
    assertEquals("https://cloud.example.com", config.baseUrl());
    assertEquals("dc-token", config.dataCenterToken());
  }

  @Test
  void cloudWithoutCredentials_exitsOne(@TempDir Path dir) throws Exception {
    Path report = dir.resolve("TEST-suite.xml");
    Files.writeString(report, "<testsuite/>");

    assertEquals(1, cmd.execute("--data-center=false", "test-execution", "import", "-t", "junit", "-p", "TC", report.toString()));
    assertEquals(0, server.getRequestCount());
  }
}
