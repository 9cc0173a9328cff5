package io.agiletest.cli;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

final class JwtFixtures {
  private JwtFixtures() {}

  static String tokenExpiringAt(long exp) {
    return token("{\"exp\":" + exp + ",\"sub\":\"client-id\"}");
  }

  static String freshToken() {
    return tokenExpiringAt(Instant.now().plusSeconds(3600).getEpochSecond());
  }

  static String expiredToken() {
    return tokenExpiringAt(Instant.now().minusSeconds(60).getEpochSecond());
  }

  static String token(String claimsJson) {
    String header = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
    String payload = Base64.getUrlEncoder().withoutPadding()
        .encodeToString(claimsJson.getBytes(StandardCharsets.UTF_8));
    return header + "." + payload + ".c2lnbmF0dXJl";
  }
}
