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
import java.util.Base64;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads JWT claims without verifying the signature.
 */
public class JwtUtil {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static JsonNode decodePayload(String jwt) throws IOException {
    if (jwt == null || jwt.isBlank()) {
      throw new IOException("JWT is empty");
    }
    String[] parts = jwt.trim().split("\\.");
    if (parts.length < 2) {
      throw new IOException("Malformed JWT: expected header.payload[.signature]");
    }

    byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(parts[1]);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed JWT payload encoding", e);
    }

    JsonNode node = MAPPER.readTree(json);
    if (node == null || !node.isObject()) {
      throw new IOException("JWT payload is not a JSON object");
    }
    return node;
  }

  public static String getStringClaim(JsonNode payload, String claim) {
    JsonNode v = payload.get(claim);
    return (v != null && v.isTextual()) ? v.asText() : null;
  }

  /** Returns 0 when the claim is missing or not numeric. */
  public static long getLongClaim(JsonNode payload, String claim) {
    JsonNode v = payload.get(claim);
    return (v != null && v.canConvertToLong()) ? v.asLong() : 0L;
  }
}
