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

package dev.knative.eventing.kafka.clientauth.security;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;

/**
 * A client certificate chain bound to its matching private key.
 * <p>
 * Instances are only created by {@link CertificatePairLoader} once both files were read and the key was verified
 * against the leaf certificate.
 */
public final class CertificateKeyPair {

  private final byte[] certificatePem;
  private final byte[] privateKeyPem;
  private final List<X509Certificate> certificateChain;
  private final PrivateKey privateKey;

  CertificateKeyPair(final byte[] certificatePem,
                     final byte[] privateKeyPem,
                     final List<X509Certificate> certificateChain,
                     final PrivateKey privateKey) {
    this.certificatePem = certificatePem.clone();
    this.privateKeyPem = privateKeyPem.clone();
    this.certificateChain = List.copyOf(certificateChain);
    this.privateKey = privateKey;
  }

  /**
   * @return the certificate file content, as read.
   */
  public byte[] certificatePem() {
    return certificatePem.clone();
  }

  /**
   * @return the private key PEM, decrypted if the key file was encrypted, otherwise the key file content as read.
   */
  public byte[] privateKeyPem() {
    return privateKeyPem.clone();
  }

  /**
   * @return the private key as an unencrypted PKCS#8 PEM block, whatever format the key file used.
   */
  public byte[] pkcs8PrivateKeyPem() {
    return PrivateKeys.toPkcs8Pem(privateKey);
  }

  public List<X509Certificate> certificateChain() {
    return certificateChain;
  }

  public X509Certificate certificate() {
    return certificateChain.get(0);
  }

  public PrivateKey privateKey() {
    return privateKey;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CertificateKeyPair)) {
      return false;
    }
    final var other = (CertificateKeyPair) o;
    return Arrays.equals(certificatePem, other.certificatePem) && Arrays.equals(privateKeyPem, other.privateKeyPem);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(certificatePem) + Arrays.hashCode(privateKeyPem);
  }

  @Override
  public String toString() {
    return "CertificateKeyPair{subject='" + certificate().getSubjectX500Principal().getName()
      + "', chainLength=" + certificateChain.size()
      + ", keyAlgorithm=" + privateKey.getAlgorithm() + '}';
  }
}
