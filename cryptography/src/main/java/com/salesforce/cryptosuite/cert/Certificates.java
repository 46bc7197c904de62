/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.cert;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS10CertificationRequestBuilder;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;

import com.salesforce.cryptosuite.ProviderUtils;

/**
 * @author hal.hildebrand
 *
 */
public class Certificates {

    /**
     * Build a PKCS#10 certification request for the key pair's public key, signed
     * by its private key. Extensions, when present, are carried verbatim in a
     * PKCS#9 extensionRequest attribute.
     */
    public static PKCS10CertificationRequest request(DistinguishedName dn, KeyPair keyPair,
                                                     String signatureAlgorithm,
                                                     List<CertExtension> extensions) throws OperatorCreationException,
                                                                                     IOException {
        final ContentSigner signer = new JcaContentSignerBuilder(signatureAlgorithm).setProvider(ProviderUtils.getProviderBC())
                                                                                    .build(keyPair.getPrivate());
        final PKCS10CertificationRequestBuilder builder = new JcaPKCS10CertificationRequestBuilder(dn.getX500Name(),
                                                                                                   keyPair.getPublic());
        if (extensions != null && !extensions.isEmpty()) {
            final ExtensionsGenerator generator = new ExtensionsGenerator();
            for (final CertExtension e : extensions) {
                generator.addExtension(e.oid(), e.critical(), e.value());
            }
            builder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, generator.generate());
        }
        return builder.build(signer);
    }

    /**
     * Build a certificate where issuer and subject are the same name, signed by
     * the key pair's private key. The certificate is verified against the key
     * pair's public key and checked for validity at <code>notBefore</code> before
     * being returned.
     */
    public static X509Certificate selfSign(DistinguishedName dn, BigInteger serialNumber, KeyPair keyPair,
                                           String signatureAlgorithm, Instant notBefore, Instant notAfter,
                                           List<CertExtension> extensions) throws OperatorCreationException,
                                                                           GeneralSecurityException, IOException {
        final ContentSigner sigGen = new JcaContentSignerBuilder(signatureAlgorithm).setProvider(ProviderUtils.getProviderBC())
                                                                                    .build(keyPair.getPrivate());

        final SubjectPublicKeyInfo subPubKeyInfo = SubjectPublicKeyInfo.getInstance(keyPair.getPublic()
                                                                                           .getEncoded());

        final X509v3CertificateBuilder certBuilder = new X509v3CertificateBuilder(dn.getX500Name(), serialNumber,
                                                                                  Date.from(notBefore),
                                                                                  Date.from(notAfter),
                                                                                  dn.getX500Name(), subPubKeyInfo);

        for (final CertExtension e : extensions) {
            certBuilder.addExtension(e.oid(), e.critical(), e.value());
        }

        final X509CertificateHolder holder = certBuilder.build(sigGen);
        final X509Certificate cert = new JcaX509CertificateConverter().setProvider(ProviderUtils.getProviderBC())
                                                                      .getCertificate(holder);

        cert.checkValidity(Date.from(notBefore));
        cert.verify(keyPair.getPublic(), ProviderUtils.getProviderBC());

        return cert;
    }

    private Certificates() {
    }
}
