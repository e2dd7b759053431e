package com.codeheadsystems.hdriv.manager;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.encryption.EnvelopeCipher;
import com.codeheadsystems.envelope.model.DataUrl;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.exception.UnsupportedLegacySchemeException;
import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.ImmutableAsset;
import com.codeheadsystems.hdriv.model.StoredAsset;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a stored asset into its bytes.
 */
@Singleton
public class AssetResolver {

  private static final Logger log = LoggerFactory.getLogger(AssetResolver.class);

  private final EnvelopeCipher envelopeCipher;
  private final BinaryTextCodec codec;

  /**
   * Instantiates a new Asset resolver.
   *
   * @param envelopeCipher the envelope cipher
   * @param codec          the codec
   */
  @Inject
  public AssetResolver(final EnvelopeCipher envelopeCipher,
                       final BinaryTextCodec codec) {
    log.info("AssetResolver({}, {})", envelopeCipher, codec);
    this.envelopeCipher = envelopeCipher;
    this.codec = codec;
  }

  /**
   * Resolve asset.
   *
   * @param stored the stored asset
   * @return the asset
   * @throws com.codeheadsystems.envelope.exception.DecryptionException if an envelope cannot be opened
   * @throws UnsupportedLegacySchemeException                           if the asset uses a retired scheme
   * @throws IllegalArgumentException                                   if plain data is not valid base64
   */
  public Asset resolve(final StoredAsset stored) {
    log.trace("resolve({})", stored.name());
    final ImmutableAsset.Builder builder = ImmutableAsset.builder()
        .name(stored.name())
        .lights(stored.lights());
    switch (stored.encoding()) {
      case ENVELOPE -> builder.bytes(envelopeCipher.decryptPayload(stored.packet()
          .orElseThrow(() -> new InvalidFormatException("Envelope asset without packet: " + stored.name()))));
      case PLAIN -> decodePlain(stored.data(), builder);
      case RETIRED -> throw new UnsupportedLegacySchemeException(stored.name(), stored.scheme().orElse(null));
      default -> throw new IllegalStateException("Unknown encoding: " + stored.encoding());
    }
    return builder.build();
  }

  private void decodePlain(final String data, final ImmutableAsset.Builder builder) {
    if (data.startsWith(BinaryTextCodec.DATA_URL_PREFIX)) {
      final DataUrl dataUrl = codec.decodeDataUrl(data);
      builder.bytes(dataUrl.bytes());
      if (!dataUrl.contentType().isEmpty()) {
        builder.contentType(dataUrl.contentType());
      }
    } else {
      builder.bytes(codec.decode(data));
    }
  }

}
