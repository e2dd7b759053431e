package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key material from a configured secret. The secret is either base64 of 32 bytes, or a 32
 * byte UTF-8 string so files written with a raw text secret can still be opened.
 */
public class StaticKeySource implements KeySource {

  private static final Logger log = LoggerFactory.getLogger(StaticKeySource.class);

  private final String secret;
  private final BinaryTextCodec codec;

  /**
   * Instantiates a new Static key source.
   *
   * @param secret the secret
   * @param codec  the codec
   */
  public StaticKeySource(final String secret, final BinaryTextCodec codec) {
    log.info("StaticKeySource({})", codec);
    this.secret = secret;
    this.codec = codec;
  }

  @Override
  public byte[] loadKeyMaterial() {
    log.trace("loadKeyMaterial()");
    if (secret == null || secret.isEmpty()) {
      throw new KeyUnavailableException("No static secret configured");
    }
    try {
      final byte[] decoded = codec.decode(secret);
      if (decoded.length == KEY_LENGTH) {
        return decoded;
      }
    } catch (IllegalArgumentException e) {
      log.debug("Static secret is not base64, trying it as text");
    }
    final byte[] text = secret.getBytes(StandardCharsets.UTF_8);
    if (text.length != KEY_LENGTH) {
      throw new KeyUnavailableException("Static secret must be base64 of 32 bytes or 32 bytes of text");
    }
    return text;
  }
}
