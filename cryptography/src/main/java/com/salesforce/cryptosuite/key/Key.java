/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

import java.util.List;

import com.salesforce.cryptosuite.cert.CertExtension;

/**
 * A key managed by the cryptographic provider. Callers dispatch through these
 * methods only; implementations decide which of them they support.
 *
 * @author hal.hildebrand
 *
 */
public interface Key {

    String DEFAULT_SELF_SIGNED_SUBJECT = "/CN=self";

    /**
     * Generate a PKCS#10 certification request for this key
     *
     * @param subject    - the subject name in RFC 2253 (LDAP) form, or OpenSSL one
     *                   line form
     * @param extensions - additional X.509v3 extensions requested, may be empty
     * @return the PEM encoded request
     * @throws NotPrivateKeyException if this is a public only key
     * @throws CsrGenerationException if the request cannot be built
     */
    String generateCsr(String subject, List<CertExtension> extensions);

    default String generateCsr(String subject) {
        return generateCsr(subject, List.of());
    }

    default String generateSelfSignedCertificate() {
        return generateSelfSignedCertificate(DEFAULT_SELF_SIGNED_SUBJECT);
    }

    /**
     * Generate a self signed X.509 certificate for this key
     *
     * @param subject - the subject, and issuer, of the certificate
     * @return the PEM encoded certificate
     * @throws NotPrivateKeyException         if this is a public only key
     * @throws CertificateGenerationException if the certificate cannot be built
     */
    String generateSelfSignedCertificate(String subject);

    /**
     * @return the handle of this key inside a hardware security module
     * @throws UnsupportedOperationException if the key is not held by an HSM
     */
    Object getHandleForHsm();

    /**
     * @return the subject key identifier, a stable fingerprint of the public part
     *         of this key
     */
    byte[] getIdentity();

    /**
     * @return the public part of this key; this key if it is already public
     */
    Key getPublicKey();

    boolean isPrivate();

    boolean isSymmetric();

    /**
     * @return the PEM encoding of this key, as UTF-8 bytes
     */
    byte[] toBytes();
}
