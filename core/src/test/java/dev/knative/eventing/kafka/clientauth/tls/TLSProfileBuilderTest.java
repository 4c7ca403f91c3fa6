/*
 * Copyright © 2018 Knative Authors (knative-dev@googlegroups.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.knative.eventing.kafka.clientauth.tls;

import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.CA;
import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.CLIENT;
import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.CLIENT_KEYS;
import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.certificatePem;
import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.traditionalKeyPem;
import static dev.knative.eventing.kafka.clientauth.testing.SecurityMaterials.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.knative.eventing.kafka.clientauth.errors.ConnectionProfileException;
import dev.knative.eventing.kafka.clientauth.errors.FileAccessException;
import dev.knative.eventing.kafka.clientauth.errors.PemParseException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TLSProfileBuilderTest {

  @TempDir
  Path dir;

  @Test
  public void disabledConfigReadsNoFiles() {
    final var config = TLSConfig.builder()
      .withEnabled(false)
      .withCaFile(dir.resolve("missing-ca.crt").toString())
      .withCertFile(dir.resolve("missing.crt").toString())
      .build();

    final var profile = TLSProfileBuilder.build(config);

    assertThat(profile).isSameAs(TLSProfile.disabled());
    assertThat(profile.enabled()).isFalse();
    assertThat(profile.clientCertificate()).isNull();
  }

  @Test
  public void enabledWithoutFilesUsesDefaultTrust() {
    final var profile = TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).build());

    assertThat(profile.enabled()).isTrue();
    assertThat(profile.insecureSkipVerify()).isFalse();
    assertThat(profile.trustedCertificates()).isEmpty();
    assertThat(profile.clientCertificate()).isNull();
    assertThat(profile.createSSLContext()).isNotNull();
  }

  @Test
  public void shouldLoadCertificateAuthoritiesAndClientPair() {
    final var config = TLSConfig.builder()
      .withEnabled(true)
      .withCaFile(write(dir, "ca.crt", certificatePem(CA)))
      .withCertFile(write(dir, "tls.crt", certificatePem(CLIENT)))
      .withKeyFile(write(dir, "tls.key", traditionalKeyPem(CLIENT_KEYS.getPrivate())))
      .build();

    final var profile = TLSProfileBuilder.build(config);

    assertThat(profile.trustedCertificates()).containsExactly(CA);
    assertThat(profile.clientCertificate()).isNotNull();
    assertThat(profile.clientCertificate().certificate()).isEqualTo(CLIENT);
    assertThat(profile.createSSLContext().getProtocol()).isEqualTo("TLS");
    assertThat(TLSProfileBuilder.build(config)).isEqualTo(profile);
  }

  @Test
  public void shouldCopyInsecureSkipVerify() {
    final var profile = TLSProfileBuilder.build(TLSConfig.builder()
      .withEnabled(true)
      .withInsecureSkipVerify(true)
      .build());

    assertThat(profile.insecureSkipVerify()).isTrue();
    assertThat(profile.createSSLContext()).isNotNull();
  }

  @Test
  public void blankCaFileGivesEmptyTrustList() {
    final var profile = TLSProfileBuilder.build(TLSConfig.builder()
      .withEnabled(true)
      .withCaFile(write(dir, "ca.crt", "\n  \n"))
      .build());

    assertThat(profile.trustedCertificates()).isEmpty();
  }

  @Test
  public void caFileWithoutCertificateFails() {
    final var caFile = write(dir, "ca.crt", "this is not a certificate");

    assertThatThrownBy(() -> TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).withCaFile(caFile).build()))
      .isInstanceOf(PemParseException.class)
      .hasMessageContaining(caFile);
  }

  @Test
  public void corruptCaFileFails() {
    final var caFile = write(dir, "ca.crt", "-----BEGIN CERTIFICATE-----\nAAAA\n-----END CERTIFICATE-----\n");

    assertThatThrownBy(() -> TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).withCaFile(caFile).build()))
      .isInstanceOf(PemParseException.class)
      .hasMessageContaining("CA file");
  }

  @Test
  public void missingCaFileFails() {
    final var caFile = dir.resolve("missing-ca.crt").toString();

    assertThatThrownBy(() -> TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).withCaFile(caFile).build()))
      .isInstanceOf(FileAccessException.class)
      .hasMessageContaining(caFile);
  }

  @Test
  public void certificateWithoutKeyFails() {
    final var certFile = write(dir, "tls.crt", certificatePem(CLIENT));

    assertThatThrownBy(() -> TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).withCertFile(certFile).build()))
      .isInstanceOf(FileAccessException.class)
      .hasMessageContaining("certificate and key must be supplied as a pair");
  }

  @Test
  public void keyWithoutCertificateFails() {
    final var keyFile = write(dir, "tls.key", traditionalKeyPem(CLIENT_KEYS.getPrivate()));

    final var ex = assertThrows(
      FileAccessException.class,
      () -> TLSProfileBuilder.build(TLSConfig.builder().withEnabled(true).withKeyFile(keyFile).build())
    );

    assertThat(ex.getMessage())
      .startsWith("cannot read certificate file")
      .contains("certificate and key must be supplied as a pair");
  }

  @Test
  public void keyWithMissingCertificateFileNamesCertificatePath() {
    final var keyFile = write(dir, "tls.key", traditionalKeyPem(CLIENT_KEYS.getPrivate()));
    final var certFile = dir.resolve("missing.crt").toString();

    final var ex = assertThrows(
      FileAccessException.class,
      () -> TLSProfileBuilder.build(TLSConfig.builder()
        .withEnabled(true)
        .withCertFile(certFile)
        .withKeyFile(keyFile)
        .build())
    );

    assertThat(ex.path()).isEqualTo(certFile);
    assertThat(ex.getMessage()).contains(certFile);
  }

  @Test
  public void disabledProfileCannotCreateSSLContext() {
    assertThatThrownBy(() -> TLSProfile.disabled().createSSLContext())
      .isInstanceOf(ConnectionProfileException.class);
  }

  @Test
  public void toStringRedactsPassphrase() {
    final var config = TLSConfig.builder().withEnabled(true).withPassphrase("s3cr3t").build();

    assertThat(config.toString()).doesNotContain("s3cr3t");
  }
}
