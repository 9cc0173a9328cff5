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

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the AgileTest API.
 * Cloud installs authenticate with a client id and secret, Data Center installs with a static token.
 */
public record AgileTestConfig(
    String clientId,
    String clientSecret,
    String baseUrl,
    String authBaseUrl,
    Duration timeout,
    boolean dataCenter,
    String dataCenterToken
) {

  //── Environment variables ───────────────────────────────────────────────────────
  public static final String ENV_CLIENT_ID     = "AGILETEST_CLIENT_ID";
  public static final String ENV_CLIENT_SECRET = "AGILETEST_CLIENT_SECRET";
  public static final String ENV_BASE_URL      = "AGILETEST_BASE_URL";
  public static final String ENV_AUTH_BASE_URL = "AGILETEST_AUTH_BASE_URL";
  public static final String ENV_TIMEOUT       = "AGILETEST_TIMEOUT";
  public static final String ENV_DATA_CENTER   = "AGILETEST_DATA_CENTER";
  public static final String ENV_DC_TOKEN      = "AGILETEST_DC_TOKEN";

  //── Defaults ────────────────────────────────────────────────────────────────────
  public static final String DEFAULT_BASE_URL      = "https://api.agiletest.app";
  public static final String DEFAULT_AUTH_BASE_URL = "https://agiletest.atlas.devsamurai.com";
  public static final Duration DEFAULT_TIMEOUT     = Duration.ofSeconds(30);

  public static AgileTestConfig fromEnvironment(Map<String, String> env) {
    return new AgileTestConfig(
        env.get(ENV_CLIENT_ID),
        env.get(ENV_CLIENT_SECRET),
        valueOrDefault(env.get(ENV_BASE_URL), DEFAULT_BASE_URL),
        valueOrDefault(env.get(ENV_AUTH_BASE_URL), DEFAULT_AUTH_BASE_URL),
        parseTimeout(env.get(ENV_TIMEOUT)),
        Boolean.parseBoolean(env.get(ENV_DATA_CENTER)),
        env.get(ENV_DC_TOKEN)
    );
  }

  public AgileTestConfig withClientId(String v) {
    return new AgileTestConfig(v, clientSecret, baseUrl, authBaseUrl, timeout, dataCenter, dataCenterToken);
  }

  public AgileTestConfig withClientSecret(String v) {
    return new AgileTestConfig(clientId, v, baseUrl, authBaseUrl, timeout, dataCenter, dataCenterToken);
  }

  public AgileTestConfig withBaseUrl(String v) {
    return new AgileTestConfig(clientId, clientSecret, v, authBaseUrl, timeout, dataCenter, dataCenterToken);
  }

  public AgileTestConfig withAuthBaseUrl(String v) {
    return new AgileTestConfig(clientId, clientSecret, baseUrl, v, timeout, dataCenter, dataCenterToken);
  }

  public AgileTestConfig withTimeout(Duration v) {
    return new AgileTestConfig(clientId, clientSecret, baseUrl, authBaseUrl, v, dataCenter, dataCenterToken);
  }

  public AgileTestConfig withDataCenter(boolean v) {
    return new AgileTestConfig(clientId, clientSecret, baseUrl, authBaseUrl, timeout, v, dataCenterToken);
  }

  public AgileTestConfig withDataCenterToken(String v) {
    return new AgileTestConfig(clientId, clientSecret, baseUrl, authBaseUrl, timeout, dataCenter, v);
  }

  static Duration parseTimeout(String seconds) {
    if (seconds == null || seconds.isBlank()) {
      return DEFAULT_TIMEOUT;
    }
    try {
      long value = Long.parseLong(seconds.trim());
      if (value <= 0) {
        throw new AgileTestConfigurationException(ENV_TIMEOUT + " must be a positive number of seconds: " + seconds);
      }
      return Duration.ofSeconds(value);
    } catch (NumberFormatException e) {
      throw new AgileTestConfigurationException(ENV_TIMEOUT + " is not a number of seconds: " + seconds, e);
    }
  }

  private static String valueOrDefault(String value, String fallback) {
    return (value == null || value.isBlank()) ? fallback : value;
  }
}
