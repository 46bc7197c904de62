/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.cert;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;

/**
 * An X.509v3 extension, as added to certificates and carried in certification
 * requests
 *
 * @author hal.hildebrand
 *
 */
public record CertExtension(ASN1ObjectIdentifier oid, boolean critical, ASN1Encodable value) {

    public enum KeyUsage {
        DIGITAL_SIGNATURE(org.bouncycastle.asn1.x509.KeyUsage.digitalSignature),
        NON_REPUDIATION(org.bouncycastle.asn1.x509.KeyUsage.nonRepudiation);

        private final int bit;

        private KeyUsage(final int bit) {
            this.bit = bit;
        }
    }

    /**
     * Basic constraints of a certificate that cannot issue others. Critical.
     */
    public static CertExtension endEntity() {
        return new CertExtension(Extension.basicConstraints, true, new BasicConstraints(false));
    }

    public static CertExtension extendedKeyUsage(final KeyPurposeId... purposes) {
        return new CertExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(purposes));
    }

    public static CertExtension keyUsage(final KeyUsage... usages) {
        int bits = 0;
        for (final KeyUsage usage : usages) {
            bits |= usage.bit;
        }
        return new CertExtension(Extension.keyUsage, false, new org.bouncycastle.asn1.x509.KeyUsage(bits));
    }

    @Override
    public String toString() {
        return "Extension [" + oid + (critical ? " (critical)" : "") + "=" + value + "]";
    }
}
