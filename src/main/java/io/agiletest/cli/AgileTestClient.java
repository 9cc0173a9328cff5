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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Uploads test execution results to AgileTest, either as a raw report body or as a multipart form
 * carrying the report together with test execution metadata.
 *
 * <p>Upload failures (non-2xx status, body that is not a test execution JSON object) are logged and
 * reported as an empty result. Configuration problems and rejected credential exchanges are thrown.
 */
public class AgileTestClient {
    private static final Logger log = LoggerFactory.getLogger(AgileTestClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final MediaType JSON = MediaType.get("application/json");

    //── API paths, suffixed with the framework type ────────────────────────────────
    static final String CLOUD_UPLOAD_PATH           = "/ds/test-executions/";
    static final String CLOUD_MULTIPART_SUFFIX      = "/multipart";
    static final String DATA_CENTER_UPLOAD_PATH     = "/rest/agiletest/1.0/test-executions/automation/";
    static final String DATA_CENTER_MULTIPART_PATH  = "/plugins/servlet/agiletest/automation/multipart/";

    static final String PART_RESULTS        = "results";
    static final String PART_TEST_EXECUTION = "testExecution";
    static final String INFO_FILENAME       = "info.json";

    private final String baseUrl;
    private final boolean dataCenter;
    private final ResultFileTypes fileTypes;
    private final OkHttpClient client;

    public record TestExecutionResponse(
            String key,
            String url,
            List<JsonNode> missedCases
    ) {
        public TestExecutionResponse {
            missedCases = missedCases == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(missedCases));
        }

        /**
         * Reads the response leniently: unknown fields are ignored, and a {@code missedCases} value that
         * is not an array is kept as a single entry unless it is null or an empty string.
         */
        static TestExecutionResponse fromJson(JsonNode root) {
            JsonNode missed = root.path("missedCases");
            List<JsonNode> missedCases = new ArrayList<>();
            if (missed.isArray()) {
                missed.forEach(missedCases::add);
            } else if (!missed.isMissingNode() && !missed.isNull()
                    && !(missed.isTextual() && missed.asText().isEmpty())) {
                missedCases.add(missed);
            }
            return new TestExecutionResponse(textOrNull(root, "key"), textOrNull(root, "url"), missedCases);
        }

        private static String textOrNull(JsonNode root, String field) {
            JsonNode v = root.get(field);
            return (v == null || v.isNull()) ? null : v.asText();
        }
    }

    public AgileTestClient(AgileTestConfig config) {
        this(config, ResultFileTypes.DEFAULT);
    }

    public AgileTestClient(AgileTestConfig config, ResultFileTypes fileTypes) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new AgileTestConfigurationException("Base URL is required");
        }
        OkHttpClient base = new OkHttpClient()
                .newBuilder()
                .connectTimeout(config.timeout())
                .readTimeout(config.timeout())
                .writeTimeout(config.timeout())
                .callTimeout(config.timeout())
                .build();

        this.baseUrl = AgileTestAuth.normalizeUrl(config.baseUrl());
        this.dataCenter = config.dataCenter();
        this.fileTypes = fileTypes;
        AgileTestAuth auth = new AgileTestAuth(
                config.clientId(),
                config.clientSecret(),
                config.authBaseUrl(),
                config.dataCenter(),
                config.dataCenterToken(),
                base);
        this.client = base.newBuilder()
                .addInterceptor(auth)
                .build();
    }

    OkHttpClient httpClient() {
        return client;
    }

    /**
     * Uploads a result report as the raw request body.
     *
     * @param frameworkType    test framework that produced the report, e.g. {@code junit}
     * @param projectKey       Jira project key
     * @param testData         report contents
     * @param testExecutionKey test execution issue to import into; a new one is created when blank
     * @return the created or updated test execution, empty if the upload failed
     * @throws AgileTestConfigurationException if the framework type is unsupported or has no mime type
     * @throws IOException on transport errors or a rejected credential exchange
     */
    public Optional<TestExecutionResponse> uploadTestExecutionText(
            String frameworkType,
            String projectKey,
            String testData,
            String testExecutionKey
    ) throws IOException {
        String framework = fileTypes.checkFramework(frameworkType);
        ResultFileTypes.FileType fileType = fileTypes.resolve(framework);
        if (projectKey == null || projectKey.isBlank()) {
            throw new AgileTestConfigurationException("Project key is required");
        }

        String path = dataCenter
                ? DATA_CENTER_UPLOAD_PATH + framework
                : CLOUD_UPLOAD_PATH + framework;
        HttpUrl.Builder url = HttpUrl.get(baseUrl + path)
                .newBuilder()
                .addQueryParameter("projectKey", projectKey);
        if (testExecutionKey != null && !testExecutionKey.isBlank()) {
            url.addQueryParameter("testExecutionKey", testExecutionKey);
        }

        Request request = new Request.Builder()
                .url(url.build())
                .post(RequestBody.create(testData.getBytes(StandardCharsets.UTF_8), MediaType.get(fileType.mimeType())))
                .build();

        return execute(request);
    }

    /**
     * Uploads a result report and test execution metadata as {@code multipart/form-data}.
     *
     * @param frameworkType     test framework that produced the report, e.g. {@code junit}
     * @param testResults       report contents, sent as {@code results.<ext>}
     * @param testExecutionInfo test execution fields as JSON, sent as {@code info.json}
     * @return the created or updated test execution, empty if the upload failed
     * @throws AgileTestConfigurationException if the framework type is unsupported or has no mime type
     * @throws IOException on transport errors or a rejected credential exchange
     */
    public Optional<TestExecutionResponse> uploadTestExecutionMultipart(
            String frameworkType,
            String testResults,
            String testExecutionInfo
    ) throws IOException {
        String framework = fileTypes.checkFramework(frameworkType);
        ResultFileTypes.FileType fileType = fileTypes.resolve(framework);

        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart(
                        PART_RESULTS,
                        "results." + fileType.extension(),
                        RequestBody.create(testResults.getBytes(StandardCharsets.UTF_8), MediaType.get(fileType.mimeType())))
                .addFormDataPart(
                        PART_TEST_EXECUTION,
                        INFO_FILENAME,
                        RequestBody.create(testExecutionInfo.getBytes(StandardCharsets.UTF_8), JSON))
                .build();

        String path = dataCenter
                ? DATA_CENTER_MULTIPART_PATH + framework
                : CLOUD_UPLOAD_PATH + framework + CLOUD_MULTIPART_SUFFIX;
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(body)
                .build();

        return execute(request);
    }

    private Optional<TestExecutionResponse> execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("Request Error: {} {} - {} - {}",
                        request.method(), request.url().encodedPath(), response.code(), responseBody);
                return Optional.empty();
            }

            JsonNode root;
            try {
                root = MAPPER.readTree(responseBody);
            } catch (JsonProcessingException e) {
                log.error("Response invalid JSON response: {} - {}", e.getOriginalMessage(), responseBody);
                return Optional.empty();
            }
            if (root == null || !root.isObject()) {
                log.error("Response invalid JSON response: expected an object - {}", responseBody);
                return Optional.empty();
            }
            TestExecutionResponse result = TestExecutionResponse.fromJson(root);

            log.info("Test execution uploaded successfully: '{}'", responseBody);
            if (!result.missedCases().isEmpty()) {
                log.warn("Test execution {} with missed test cases: {}", result.key(), result.missedCases());
            }
            log.info("Test Execution issue updated: {} {}", result.key(), result.url());
            return Optional.of(result);
        }
    }
}
