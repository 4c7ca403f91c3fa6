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

package dev.knative.eventing.kafka.clientauth.testing;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PKCS8Generator;
import org.bouncycastle.openssl.jcajce.JcaMiscPEMGenerator;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8EncryptorBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMEncryptorBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.util.io.pem.PemObjectGenerator;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * Certificates and keys generated once per JVM, plus helpers to write them as PEM files.
 */
public final class SecurityMaterials {

  private static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();
  private static final SecureRandom RANDOM = new SecureRandom();

  public static final String CA_DN = "CN=Test CA,O=Knative";
  public static final String CLIENT_DN = "CN=kafka-client,O=Knative";

  public static final KeyPair CA_KEYS = rsaKeyPair();
  public static final X509Certificate CA = certificate(CA_DN, CA_KEYS, CA_DN, CA_KEYS.getPrivate(), true);

  public static final KeyPair CLIENT_KEYS = rsaKeyPair();
  public static final X509Certificate CLIENT = certificate(CLIENT_DN, CLIENT_KEYS, CA_DN, CA_KEYS.getPrivate(), false);

  public static final KeyPair OTHER_KEYS = rsaKeyPair();

  private SecurityMaterials() {
  }

  public static KeyPair rsaKeyPair() {
    try {
      final var generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(2048, RANDOM);
      return generator.generateKeyPair();
    } catch (final Exception ex) {
      throw new IllegalStateException(ex);
    }
  }

  public static X509Certificate certificate(final String dn,
                                            final KeyPair subjectKeys,
                                            final String issuerDn,
                                            final PrivateKey issuerKey,
                                            final boolean ca) {
    try {
      final var now = Instant.now();
      final var builder = new JcaX509v3CertificateBuilder(
        new X500Name(issuerDn),
        new BigInteger(64, RANDOM),
        Date.from(now.minus(Duration.ofDays(1))),
        Date.from(now.plus(Duration.ofDays(30))),
        new X500Name(dn),
        subjectKeys.getPublic()
      );
      builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(ca));
      final var signer = new JcaContentSignerBuilder("SHA256withRSA").build(issuerKey);
      return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    } catch (final Exception ex) {
      throw new IllegalStateException(ex);
    }
  }

  public static String certificatePem(final X509Certificate... certificates) {
    final var sb = new StringBuilder();
    for (final var certificate : certificates) {
      sb.append(pem(misc(certificate)));
    }
    return sb.toString();
  }

  /**
   * @return the key as PKCS#1 ("RSA PRIVATE KEY").
   */
  public static String traditionalKeyPem(final PrivateKey key) {
    return pem(misc(key));
  }

  public static String pkcs8KeyPem(final PrivateKey key) {
    try {
      return pem(new JcaPKCS8Generator(key, null));
    } catch (final Exception ex) {
      throw new IllegalStateException(ex);
    }
  }

  /**
   * @return the key as PKCS#1 with {@code Proc-Type: 4,ENCRYPTED} and {@code DEK-Info} headers.
   */
  public static String legacyEncryptedKeyPem(final PrivateKey key, final String passphrase) {
    try {
      final var encryptor = new JcePEMEncryptorBuilder("AES-128-CBC")
        .setProvider(PROVIDER)
        .setSecureRandom(RANDOM)
        .build(passphrase.toCharArray());
      return pem(new JcaMiscPEMGenerator(key, encryptor));
    } catch (final IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static String encryptedPkcs8KeyPem(final PrivateKey key, final String passphrase) {
    try {
      final var encryptor = new JceOpenSSLPKCS8EncryptorBuilder(PKCS8Generator.AES_256_CBC)
        .setProvider(PROVIDER)
        .setRandom(RANDOM)
        .setPassword(passphrase.toCharArray())
        .build();
      return pem(new JcaPKCS8Generator(key, encryptor));
    } catch (final Exception ex) {
      throw new IllegalStateException(ex);
    }
  }

  public static String write(final Path dir, final String name, final String content) {
    try {
      return Files.writeString(dir.resolve(name), content, StandardCharsets.US_ASCII).toString();
    } catch (final IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static PemObjectGenerator misc(final Object o) {
    try {
      return new JcaMiscPEMGenerator(o);
    } catch (final IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static String pem(final PemObjectGenerator generator) {
    final var out = new StringWriter();
    try (final var writer = new PemWriter(out)) {
      writer.writeObject(generator);
    } catch (final IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }
}
