package com.codeheadsystems.envelope.codec;

import com.codeheadsystems.envelope.model.DataUrl;
import com.codeheadsystems.envelope.model.ImmutableDataUrl;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts binary data to radix-64 text and back.
 *
 * <p>Output uses the standard alphabet with '=' padding and no line breaks. Decoding is strict:
 * any character outside the alphabet, a length that is not a multiple of four, or misplaced
 * padding is rejected with an {@link IllegalArgumentException}.</p>
 *
 * <p>Also reads the {@code data:<type>;base64,<payload>} form used by early project files.</p>
 */
@Singleton
public class BinaryTextCodec {

  /**
   * Prefix of every data url.
   */
  public static final String DATA_URL_PREFIX = "data:";
  /**
   * Separator between the content type and the payload.
   */
  public static final String BASE64_MARKER = ";base64,";

  private static final Logger log = LoggerFactory.getLogger(BinaryTextCodec.class);
  private static final char PAD = '=';

  private final Base64 base64;

  /**
   * Instantiates a new Binary text codec.
   */
  @Inject
  public BinaryTextCodec() {
    log.info("BinaryTextCodec()");
    this.base64 = new Base64(0, null, false, CodecPolicy.STRICT);
  }

  private static boolean isAlphabet(final char c) {
    return (c >= 'A' && c <= 'Z')
        || (c >= 'a' && c <= 'z')
        || (c >= '0' && c <= '9')
        || c == '+'
        || c == '/';
  }

  /**
   * Encode bytes into padded radix-64 text.
   *
   * @param bytes the bytes
   * @return the text
   */
  public String encode(final byte[] bytes) {
    log.trace("encode({} bytes)", bytes.length);
    return base64.encodeToString(bytes);
  }

  /**
   * Decode radix-64 text.
   *
   * @param text the text
   * @return the bytes
   * @throws IllegalArgumentException if the text is not well formed
   */
  public byte[] decode(final String text) {
    log.trace("decode({} chars)", text == null ? 0 : text.length());
    validate(text);
    return base64.decode(text);
  }

  /**
   * Decode a legacy data url.
   *
   * @param text the data url
   * @return the data url
   * @throws IllegalArgumentException if the text is not a base64 data url
   */
  public DataUrl decodeDataUrl(final String text) {
    log.trace("decodeDataUrl({} chars)", text == null ? 0 : text.length());
    if (text == null || !text.startsWith(DATA_URL_PREFIX)) {
      throw new IllegalArgumentException("Not a data url");
    }
    final int marker = text.indexOf(BASE64_MARKER);
    if (marker < 0) {
      throw new IllegalArgumentException("Data url is not base64 encoded");
    }
    final String contentType = text.substring(DATA_URL_PREFIX.length(), marker);
    final String payload = text.substring(marker + BASE64_MARKER.length());
    return ImmutableDataUrl.builder()
        .contentType(contentType)
        .bytes(decode(payload))
        .build();
  }

  /**
   * Build a data url. Only used to produce legacy documents.
   *
   * @param contentType the content type
   * @param bytes       the bytes
   * @return the data url
   */
  public String toDataUrl(final String contentType, final byte[] bytes) {
    log.trace("toDataUrl({}, {} bytes)", contentType, bytes.length);
    return DATA_URL_PREFIX + contentType + BASE64_MARKER + encode(bytes);
  }

  private void validate(final String text) {
    if (text == null) {
      throw new IllegalArgumentException("Text is null");
    }
    final int length = text.length();
    if (length % 4 != 0) {
      throw new IllegalArgumentException("Length is not a multiple of 4: " + length);
    }
    int padding = 0;
    for (int i = 0; i < length; i++) {
      final char c = text.charAt(i);
      if (c == PAD) {
        padding++;
      } else if (padding > 0) {
        throw new IllegalArgumentException("Padding in the middle of the text at " + i);
      } else if (!isAlphabet(c)) {
        throw new IllegalArgumentException("Invalid character at " + i);
      }
    }
    if (padding > 2) {
      throw new IllegalArgumentException("Too much padding: " + padding);
    }
  }

}
