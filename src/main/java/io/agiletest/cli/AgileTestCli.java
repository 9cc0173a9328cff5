// SPDX-License-Identifier: Apache-2.0
/* Copyright 2025 AgileTest CLI Authors & Contributors

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License. */

package io.agiletest.cli;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.agiletest.cli.AgileTestClient.TestExecutionResponse;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command line entrypoint. Connection settings come from the {@code AGILETEST_*} environment
 * variables and can be overridden per invocation with the global options.
 */
@Command(
    name = "agiletest",
    mixinStandardHelpOptions = true,
    version = "0.0.1",
    description = "Uploads automated test execution results to AgileTest.",
    subcommands = {AgileTestCli.TestExecution.class}
)
public class AgileTestCli implements Callable<Integer> {
  //── Log level, applied before the first logger is created ───────────────────────
  static final String ENV_LOG_LEVEL = "LOG_LEVEL";
  static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

  static {
    applyLogLevel(System.getenv());
  }

  private static final Logger log = LoggerFactory.getLogger(AgileTestCli.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Spec
  CommandSpec spec;

  //── Picocli-bound global options ───────────────────────────────────────────────

  @Option(names = "--client-id", description = "Cloud client ID (else AGILETEST_CLIENT_ID)")
  private String clientId;

  @Option(names = "--client-secret", description = "Cloud client secret (else AGILETEST_CLIENT_SECRET)")
  private String clientSecret;

  @Option(names = "--base-url", description = "API base URL (else AGILETEST_BASE_URL)")
  private String baseUrl;

  @Option(names = "--auth-base-url", description = "Authentication base URL (else AGILETEST_AUTH_BASE_URL)")
  private String authBaseUrl;

  @Option(names = "--timeout", description = "Request timeout in seconds (else AGILETEST_TIMEOUT)")
  private Long timeoutSeconds;

  @Option(names = "--data-center", arity = "0..1", description = "Use the Data Center API (else AGILETEST_DATA_CENTER)")
  private Boolean dataCenter;

  @Option(names = "--dc-token", description = "Data Center personal access token (else AGILETEST_DC_TOKEN)")
  private String dataCenterToken;

  Map<String, String> environment = System.getenv();

  @Override
  public Integer call() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new AgileTestCli()).execute(args);
    System.exit(exitCode);
  }

  //── Subcommands ────────────────────────────────────────────────────────────────

  @Command(
      name = "test-execution",
      mixinStandardHelpOptions = true,
      description = "Imports automated test results into test executions.",
      subcommands = {Import.class, ImportMultipart.class}
  )
  static class TestExecution implements Callable<Integer> {
    @ParentCommand
    AgileTestCli root;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
      throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
  }

  @Command(
      name = "import",
      mixinStandardHelpOptions = true,
      description = "Imports a test result report into a test execution."
  )
  static class Import implements Callable<Integer> {
    @ParentCommand
    TestExecution group;

    @Option(names = {"-t", "--framework-type"}, required = true, description = "Test framework, e.g. junit")
    String frameworkType;

    @Option(names = {"-p", "--project-key"}, required = true, description = "Jira project key")
    String projectKey;

    @Option(names = {"-te", "--test-execution-key"}, description = "Existing test execution issue to import into")
    String testExecutionKey;

    @Parameters(index = "0", paramLabel = "RESULT_FILE", description = "Test result report")
    Path resultFile;

    @Override
    public Integer call() {
      return group.root.execute(client -> client.uploadTestExecutionText(
          frameworkType,
          projectKey,
          Files.readString(resultFile, StandardCharsets.UTF_8),
          testExecutionKey));
    }
  }

  @Command(
      name = "import-multipart",
      mixinStandardHelpOptions = true,
      description = "Imports a test result report together with test execution fields."
  )
  static class ImportMultipart implements Callable<Integer> {
    @ParentCommand
    TestExecution group;

    @Option(names = {"-t", "--framework-type"}, required = true, description = "Test framework, e.g. junit")
    String frameworkType;

    @Parameters(index = "0", paramLabel = "RESULT_FILE", description = "Test result report")
    Path resultFile;

    @Parameters(index = "1", paramLabel = "INFO_FILE", description = "Test execution fields as JSON")
    Path infoFile;

    @Override
    public Integer call() {
      return group.root.execute(client -> client.uploadTestExecutionMultipart(
          frameworkType,
          Files.readString(resultFile, StandardCharsets.UTF_8),
          Files.readString(infoFile, StandardCharsets.UTF_8)));
    }
  }

  @FunctionalInterface
  interface UploadAction {
    Optional<TestExecutionResponse> upload(AgileTestClient client) throws Exception;
  }

  //── Shared execution ───────────────────────────────────────────────────────────

  int execute(UploadAction action) {
    try {
      AgileTestClient client = new AgileTestClient(resolveConfig());
      Optional<TestExecutionResponse> result = action.upload(client);
      if (result.isEmpty()) {
        log.error("Test execution upload failed");
        return 1;
      }
      PrintWriter out = spec.commandLine().getOut();
      out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result.get()));
      out.flush();
      return 0;
    } catch (Exception ex) {
      log.error("Error: {}", ex.getMessage());
      if (log.isDebugEnabled()) {
        log.error("Stack trace:", ex);
      }
      return 1;
    }
  }

  AgileTestConfig resolveConfig() {
    AgileTestConfig config = AgileTestConfig.fromEnvironment(environment);
    if (clientId != null) config = config.withClientId(clientId);
    if (clientSecret != null) config = config.withClientSecret(clientSecret);
    if (baseUrl != null) config = config.withBaseUrl(baseUrl);
    if (authBaseUrl != null) config = config.withAuthBaseUrl(authBaseUrl);
    if (timeoutSeconds != null) config = config.withTimeout(Duration.ofSeconds(timeoutSeconds));
    if (dataCenter != null) config = config.withDataCenter(dataCenter);
    if (dataCenterToken != null) config = config.withDataCenterToken(dataCenterToken);
    return config;
  }

  //── Log level ──────────────────────────────────────────────────────────────────

  /**
   * Copies {@code LOG_LEVEL} into the slf4j-simple default level unless it was set with {@code -D}.
   * Has no effect once the first logger exists.
   */
  static void applyLogLevel(Map<String, String> env) {
    String level = simpleLoggerLevel(env.get(ENV_LOG_LEVEL));
    if (level != null && System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
      System.setProperty(SIMPLE_LOGGER_LEVEL, level);
    }
  }

  /**
   * Accepts level names (DEBUG, INFO, WARNING, ...) and numeric levels (10, 20, 30, 40, 50).
   *
   * @return the slf4j-simple level, or null if the value is blank or unknown
   */
  static String simpleLoggerLevel(String logLevel) {
    if (logLevel == null || logLevel.isBlank()) {
      return null;
    }
    return switch (logLevel.trim().toUpperCase(Locale.ROOT)) {
      case "TRACE" -> "trace";
      case "DEBUG", "10" -> "debug";
      case "INFO", "20" -> "info";
      case "WARN", "WARNING", "30" -> "warn";
      case "ERROR", "CRITICAL", "FATAL", "40", "50" -> "error";
      case "OFF" -> "off";
      default -> null;
    };
  }
}
