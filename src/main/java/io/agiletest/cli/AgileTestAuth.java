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
import java.time.Instant;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Attaches AgileTest credentials to every outgoing request.
 *
 * <p>In Data Center mode the static token is sent as {@code Bearer}. In Cloud mode the client id and
 * secret are exchanged for a JWT which is cached until its {@code exp} claim passes, sent as {@code JWT},
 * and refreshed once more if the server still answers 401.
 *
 * <p>The cached token is guarded by this instance's monitor; concurrent callers that find it expired
 * refresh one after another rather than in parallel.
 */
public class AgileTestAuth implements Interceptor {
  private static final Logger log = LoggerFactory.getLogger(AgileTestAuth.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final MediaType JSON = MediaType.parse("application/json");

  static final String AUTHENTICATE_PATH = "/api/apikeys/authenticate";
  static final String AUTHORIZATION     = "Authorization";
  private static final String CLAIM_EXP = "exp";

  //── Error messages ──────────────────────────────────────────────────────────────
  private static final String ERR_NO_CLIENT_CREDENTIALS = "Client ID and Client Secret are required for Cloud version";
  private static final String ERR_NO_DC_TOKEN = AgileTestConfig.ENV_DC_TOKEN + " is required in Data Center mode";

  private final String clientId;
  private final String clientSecret;
  private final String authBaseUrl;
  private final boolean dataCenter;
  private final String dataCenterToken;
  private final OkHttpClient httpClient;

  private String token = "";

  /**
   * @param httpClient used for the credential exchange; must not carry this interceptor
   * @throws AgileTestConfigurationException if the credentials required by the selected mode are missing
   */
  public AgileTestAuth(
      String clientId,
      String clientSecret,
      String authBaseUrl,
      boolean dataCenter,
      String dataCenterToken,
      OkHttpClient httpClient
  ) {
    if (!dataCenter && (isBlank(clientId) || isBlank(clientSecret))) {
      throw new AgileTestConfigurationException(ERR_NO_CLIENT_CREDENTIALS);
    }
    if (dataCenter && isBlank(dataCenterToken)) {
      throw new AgileTestConfigurationException(ERR_NO_DC_TOKEN);
    }
    if (!dataCenter && isBlank(authBaseUrl)) {
      throw new AgileTestConfigurationException("Auth base URL is required for Cloud version");
    }
    this.clientId = clientId;
    this.clientSecret = clientSecret;
    this.authBaseUrl = authBaseUrl;
    this.dataCenter = dataCenter;
    this.dataCenterToken = dataCenterToken;
    this.httpClient = httpClient;
  }

  public static AgileTestAuth cloud(String clientId, String clientSecret, String authBaseUrl, OkHttpClient httpClient) {
    return new AgileTestAuth(clientId, clientSecret, authBaseUrl, false, null, httpClient);
  }

  public static AgileTestAuth dataCenter(String dataCenterToken, OkHttpClient httpClient) {
    return new AgileTestAuth(null, null, null, true, dataCenterToken, httpClient);
  }

  /**
   * Returns a copy of the request carrying a valid credential, exchanging client credentials first
   * when the cached token is missing, undecodable or expired.
   *
   * @throws AgileTestAuthenticationException if the credential exchange is rejected
   */
  public Request decorate(Request request) throws IOException {
    if (dataCenter) {
      return withAuthorization(request, "Bearer " + dataCenterToken);
    }
    return withAuthorization(request, "JWT " + validToken());
  }

  @NotNull
  @Override
  public Response intercept(@NotNull Chain chain) throws IOException {
    Request original = chain.request();
    Response response = chain.proceed(decorate(original));
    if (dataCenter || response.code() != 401) {
      return response;
    }

    log.debug("{} {} answered 401, refreshing token and retrying once",
        original.method(), original.url().encodedPath());
    response.close();
    String fresh = refresh();
    return chain.proceed(withAuthorization(original, "JWT " + fresh));
  }

  /**
   * Exchanges the client credentials for a new token and caches it.
   *
   * @return the new token
   * @throws AgileTestAuthenticationException if the server answers with a non-2xx status
   */
  public synchronized String refresh() throws IOException {
    if (dataCenter) {
      throw new IllegalStateException("Data Center mode uses a static token");
    }
    log.debug("Building refresh request for client id {}", clientId);
    byte[] body = MAPPER.writeValueAsBytes(new AuthenticateRequest(clientId, clientSecret));
    Request request = new Request.Builder()
        .url(normalizeUrl(authBaseUrl) + AUTHENTICATE_PATH)
        .post(RequestBody.create(body, JSON))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      String responseBody = response.body() != null ? response.body().string() : "";
      if (!response.isSuccessful()) {
        log.error("Failed to refresh token: {} - {}", response.code(), responseBody);
        throw new AgileTestAuthenticationException(response.code(),
            "Failed to refresh token: " + response.code() + " " + responseBody);
      }
      token = responseBody.trim();
      log.debug("New token: {}", token);
      return token;
    }
  }

  /**
   * A token is valid while the current epoch second is strictly before its {@code exp} claim.
   * The signature is not checked.
   */
  synchronized boolean hasValidToken() {
    if (token == null || token.isEmpty()) {
      return false;
    }
    try {
      long exp = JwtUtil.getLongClaim(JwtUtil.decodePayload(token), CLAIM_EXP);
      return Instant.now().getEpochSecond() < exp;
    } catch (IOException e) {
      log.debug("Cached token is not a decodable JWT: {}", e.getMessage());
      return false;
    }
  }

  private synchronized String validToken() throws IOException {
    if (!hasValidToken()) {
      log.debug("Refreshing token");
      return refresh();
    }
    return token;
  }

  private static Request withAuthorization(Request request, String value) {
    return request.newBuilder()
        .header(AUTHORIZATION, value)
        .build();
  }

  private record AuthenticateRequest(String clientId, String clientSecret) {}

  static String normalizeUrl(String url) {
    return (url != null && url.endsWith("/")) ? url.substring(0, url.length() - 1) : url;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
