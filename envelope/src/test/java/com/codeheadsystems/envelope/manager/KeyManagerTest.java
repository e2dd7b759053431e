package com.codeheadsystems.envelope.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.key.KeySource;
import com.codeheadsystems.envelope.model.ApplicationKey;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyManagerTest {

  @Mock private KeySource keySource;

  @InjectMocks private KeyManager keyManager;

  private static byte[] material() {
    final byte[] material = new byte[KeySource.KEY_LENGTH];
    for (int i = 0; i < material.length; i++) {
      material[i] = (byte) (i + 1);
    }
    return material;
  }

  @Test
  void getApplicationKey_importsMaterial() {
    final byte[] material = material();
    when(keySource.loadKeyMaterial()).thenReturn(material);

    final ApplicationKey result = keyManager.getApplicationKey();

    assertThat(result.secretKey().getAlgorithm()).isEqualTo("AES");
    assertThat(result.secretKey().getEncoded()).isEqualTo(material());
  }

  @Test
  void getApplicationKey_zeroesMaterial() {
    final byte[] material = material();
    when(keySource.loadKeyMaterial()).thenReturn(material);

    keyManager.getApplicationKey();

    assertThat(material).containsOnly((byte) 0);
  }

  @Test
  void getApplicationKey_cached() {
    when(keySource.loadKeyMaterial()).thenReturn(material());

    final ApplicationKey first = keyManager.getApplicationKey();
    final ApplicationKey second = keyManager.getApplicationKey();

    assertThat(second).isSameAs(first);
    verify(keySource, times(1)).loadKeyMaterial();
  }

  @Test
  void getApplicationKey_wrongLength() {
    when(keySource.loadKeyMaterial()).thenReturn(new byte[16]);
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> keyManager.getApplicationKey());
  }

  @Test
  void getApplicationKey_sourceFailure_notCached() {
    when(keySource.loadKeyMaterial())
        .thenThrow(new KeyUnavailableException("nope"))
        .thenReturn(material());

    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> keyManager.getApplicationKey());
    assertThat(keyManager.getApplicationKey()).isNotNull();
  }

  @Test
  void getApplicationKey_toStringRedacted() {
    when(keySource.loadKeyMaterial()).thenReturn(material());

    assertThat(keyManager.getApplicationKey().toString()).isEqualTo("ApplicationKey{AES, ****}");
  }

  @Test
  void getApplicationKey_concurrentFirstCalls() throws Exception {
    final AtomicInteger loads = new AtomicInteger();
    final KeyManager manager = new KeyManager(() -> {
      loads.incrementAndGet();
      return material();
    });
    final int threads = 16;
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<ApplicationKey>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return manager.getApplicationKey();
        }));
      }
      start.countDown();
      final ApplicationKey expected = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<ApplicationKey> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(expected);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(loads.get()).isEqualTo(1);
  }

}
