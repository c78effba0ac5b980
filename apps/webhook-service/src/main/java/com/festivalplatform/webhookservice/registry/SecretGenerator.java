package com.festivalplatform.webhookservice.registry;

import com.festivalplatform.webhookservice.config.WebhookServiceProperties;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

@Component
public class SecretGenerator {
  static final String PREFIX = "whsec_";
  private static final int MIN_LENGTH_BYTES = 16;

  private final SecureRandom secureRandom = new SecureRandom();
  private final int lengthBytes;

  public SecretGenerator(WebhookServiceProperties properties) {
    this(properties.getSecretLengthBytes());
  }

  SecretGenerator(int lengthBytes) {
    if (lengthBytes < MIN_LENGTH_BYTES) {
      throw new IllegalArgumentException("secret length must be >= " + MIN_LENGTH_BYTES + " bytes");
    }
    this.lengthBytes = lengthBytes;
  }

  public String generate() {
    byte[] bytes = new byte[lengthBytes];
    secureRandom.nextBytes(bytes);
    return PREFIX + HexFormat.of().formatHex(bytes);
  }
}
