/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.cryptosuite.DigestAlgorithm;
import com.salesforce.cryptosuite.ProviderUtils;
import com.salesforce.cryptosuite.cert.CertExtension;
import com.salesforce.cryptosuite.cert.CertExtension.KeyUsage;
import com.salesforce.cryptosuite.cert.Certificates;
import com.salesforce.cryptosuite.cert.DistinguishedName;
import com.salesforce.cryptosuite.cert.Pems;
import com.salesforce.cryptosuite.key.EcKeyMaterial.PrivateKeyMaterial;
import com.salesforce.cryptosuite.key.EcKeyMaterial.PublicKeyMaterial;

/**
 * The private or the public key of an ECDSA key pair.
 * <p>
 * Instances are immutable. The identity of a key is always computed over its
 * public point, so a private key and its public key share the same identity.
 *
 * @author hal.hildebrand
 *
 */
public class EcdsaKey implements Key {
    /**
     * The identity digest does not vary with the size of the curve
     */
    public static final DigestAlgorithm IDENTITY_DIGEST = DigestAlgorithm.SHA2_256;
    public static final DigestAlgorithm SIGNING_DIGEST  = DigestAlgorithm.SHA2_256;

    private static final Logger log = LoggerFactory.getLogger(EcdsaKey.class);

    /**
     * Import a key from its PEM encoding. Accepts PKCS#8 and SEC 1 private keys,
     * public keys, and certificates, which yield the certified public key.
     */
    public static EcdsaKey fromPem(String pem) {
        if (pem == null) {
            throw new InvalidKeyMaterialException("PEM encoded key is required");
        }
        final Object parsed;
        try {
            parsed = Pems.read(pem);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidKeyMaterialException("Unable to parse PEM encoded key", e);
        }
        final var converter = new JcaPEMKeyConverter().setProvider(ProviderUtils.getProviderBC());
        try {
            if (parsed instanceof PrivateKeyInfo info) {
                return of(converter.getPrivateKey(info));
            } else if (parsed instanceof PEMKeyPair pair) {
                return of(converter.getPrivateKey(pair.getPrivateKeyInfo()));
            } else if (parsed instanceof SubjectPublicKeyInfo info) {
                return of(converter.getPublicKey(info));
            } else if (parsed instanceof X509CertificateHolder holder) {
                log.debug("Importing public key of certificate: {}", holder.getSubject());
                return of(converter.getPublicKey(holder.getSubjectPublicKeyInfo()));
            }
        } catch (PEMException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidKeyMaterialException("Unable to convert PEM encoded key", e);
        }
        throw new InvalidKeyMaterialException("Unsupported PEM content: "
        + (parsed == null ? "none" : parsed.getClass().getSimpleName()));
    }

    public static EcdsaKey of(KeyPair keyPair) {
        if (keyPair == null) {
            throw new InvalidKeyMaterialException("Key pair is required");
        }
        return new EcdsaKey(new PrivateKeyMaterial(asEcPrivateKey(keyPair.getPrivate()),
                                                   asEcPublicKey(keyPair.getPublic())));
    }

    /**
     * A private key, with its public point derived from the private scalar
     */
    public static EcdsaKey of(PrivateKey privateKey) {
        final ECPrivateKey ecPrivateKey = checkScalar(asEcPrivateKey(privateKey));
        try {
            return new EcdsaKey(new PrivateKeyMaterial(ecPrivateKey, EcPoints.derivePublicKey(ecPrivateKey)));
        } catch (GeneralSecurityException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidKeyMaterialException("Unable to derive public key", e);
        }
    }

    public static EcdsaKey of(PublicKey publicKey) {
        return new EcdsaKey(new PublicKeyMaterial(asEcPublicKey(publicKey)));
    }

    private static ECPrivateKey asEcPrivateKey(PrivateKey privateKey) {
        if (privateKey == null) {
            throw new InvalidKeyMaterialException("Private key is required");
        }
        if (!isEcAlgorithm(privateKey) || !(privateKey instanceof ECPrivateKey)) {
            throw new InvalidKeyMaterialException("Not an elliptic curve private key: " + privateKey.getAlgorithm());
        }
        return (ECPrivateKey) privateKey;
    }

    private static ECPublicKey asEcPublicKey(PublicKey publicKey) {
        if (publicKey == null) {
            throw new InvalidKeyMaterialException("Public point is required");
        }
        if (!isEcAlgorithm(publicKey) || !(publicKey instanceof ECPublicKey)) {
            throw new InvalidKeyMaterialException("Not an elliptic curve public key: " + publicKey.getAlgorithm());
        }
        return (ECPublicKey) publicKey;
    }

    private static ECPrivateKey checkScalar(ECPrivateKey privateKey) {
        if (privateKey.getParams() == null) {
            throw new InvalidKeyMaterialException("Private key has no curve parameters");
        }
        final BigInteger s = privateKey.getS();
        if (s == null || s.signum() <= 0 || s.compareTo(privateKey.getParams().getOrder()) >= 0) {
            throw new InvalidKeyMaterialException("Private scalar is not in [1, n - 1]");
        }
        return privateKey;
    }

    // Bouncy Castle names imported keys "ECDSA"
    private static boolean isEcAlgorithm(java.security.Key key) {
        return "EC".equals(key.getAlgorithm()) || "ECDSA".equals(key.getAlgorithm());
    }

    private final EcKeyMaterial material;

    public EcdsaKey(EcKeyMaterial material) {
        if (material == null) {
            throw new InvalidKeyMaterialException("Key material is required, for both public and private keys");
        }
        final ECPublicKey publicKey = asEcPublicKey(material.publicKey());
        if (!EcPoints.isValid(publicKey)) {
            throw new InvalidKeyMaterialException("Public point is not a valid point of the curve");
        }
        if (EcPoints.fieldLength(publicKey.getParams()) > EcPoints.coordinateLength(publicKey.getParams())) {
            throw new InvalidKeyMaterialException("Unsupported curve, field elements are wider than the curve order: "
            + publicKey.getParams().getCurve().getField().getFieldSize() + " bits");
        }
        if (material instanceof PrivateKeyMaterial pkm) {
            final ECPrivateKey privateKey = checkScalar(asEcPrivateKey(pkm.privateKey()));
            final ECPublicKey derived;
            try {
                derived = EcPoints.derivePublicKey(privateKey);
            } catch (GeneralSecurityException | IllegalArgumentException | IllegalStateException e) {
                throw new InvalidKeyMaterialException("Unable to derive public key", e);
            }
            if (!derived.getW().equals(publicKey.getW())) {
                throw new InvalidKeyMaterialException("Public point does not match the private scalar");
            }
        }
        this.material = material;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EcdsaKey other)) {
            return false;
        }
        return isPrivate() == other.isPrivate()
        && Arrays.equals(EcPoints.uncompressed(material.publicKey()), EcPoints.uncompressed(other.material.publicKey()))
        && material.publicKey().getParams().getOrder().equals(other.material.publicKey().getParams().getOrder());
    }

    @Override
    public String generateCsr(String subject, List<CertExtension> extensions) {
        if (!isPrivate()) {
            throw new NotPrivateKeyException("A CSR cannot be generated from a public key");
        }
        final DistinguishedName dn;
        try {
            dn = DistinguishedName.parse(subject);
        } catch (IllegalArgumentException e) {
            throw new CsrGenerationException("Invalid subject: " + subject, e);
        }
        try {
            final var csr = Certificates.request(dn, keyPair(), SIGNING_DIGEST.ecdsaSignatureInstanceName(),
                                                 extensions);
            log.debug("Generated CSR for: {}", dn);
            return Pems.write(csr);
        } catch (OperatorCreationException | IOException e) {
            throw new CsrGenerationException("Unable to generate CSR for: " + subject, e);
        }
    }

    @Override
    public String generateSelfSignedCertificate(String subject) {
        return generateSelfSignedCertificate(SelfSignedParameters.newBuilder().setSubject(subject).build());
    }

    /**
     * Generate a self signed certificate, valid from
     * {@link SelfSignedParameters#BACKDATE} before until
     * {@link SelfSignedParameters#LIFETIME} after the current time of the
     * parameters' clock. The certificate is for TLS client authentication by an
     * end entity, with digital signature and non repudiation key usage.
     */
    public String generateSelfSignedCertificate(SelfSignedParameters parameters) {
        if (!isPrivate()) {
            throw new NotPrivateKeyException("An X509 certificate cannot be generated from a public key");
        }
        final DistinguishedName dn;
        try {
            dn = DistinguishedName.parse(parameters.subject());
        } catch (IllegalArgumentException e) {
            throw new CertificateGenerationException("Invalid subject: " + parameters.subject(), e);
        }
        final Instant now = parameters.clock().instant();
        final List<CertExtension> extensions = List.of(CertExtension.endEntity(),
                                                       CertExtension.keyUsage(KeyUsage.DIGITAL_SIGNATURE,
                                                                              KeyUsage.NON_REPUDIATION),
                                                       CertExtension.extendedKeyUsage(KeyPurposeId.id_kp_clientAuth));
        try {
            final var cert = Certificates.selfSign(dn, SelfSignedParameters.SERIAL_NUMBER, keyPair(),
                                                   SIGNING_DIGEST.ecdsaSignatureInstanceName(),
                                                   now.minus(SelfSignedParameters.BACKDATE),
                                                   now.plus(SelfSignedParameters.LIFETIME), extensions);
            log.debug("Generated self signed certificate for: {}", dn);
            return Pems.write(cert);
        } catch (OperatorCreationException | GeneralSecurityException | IOException e) {
            throw new CertificateGenerationException("Unable to generate certificate for: " + parameters.subject(),
                                                     e);
        }
    }

    @Override
    public Object getHandleForHsm() {
        throw new UnsupportedOperationException("This key does not have a PKCS11 handle");
    }

    /**
     * @return the SHA-256 digest of the uncompressed encoding of the public point
     */
    @Override
    public byte[] getIdentity() {
        return IDENTITY_DIGEST.hashOf(EcPoints.uncompressed(material.publicKey()));
    }

    public String getIdentityHex() {
        return Hex.toHexString(getIdentity());
    }

    public EcKeyMaterial getMaterial() {
        return material;
    }

    @Override
    public EcdsaKey getPublicKey() {
        if (!isPrivate()) {
            return this;
        }
        return new EcdsaKey(new PublicKeyMaterial(material.publicKey()));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(EcPoints.uncompressed(material.publicKey())) * 31 + Boolean.hashCode(isPrivate());
    }

    @Override
    public boolean isPrivate() {
        return material instanceof PrivateKeyMaterial;
    }

    @Override
    public boolean isSymmetric() {
        return false;
    }

    @Override
    public byte[] toBytes() {
        return toPem().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the unencrypted PKCS#8 encoding of a private key, or the
     *         SubjectPublicKeyInfo encoding of a public key
     */
    public String toPem() {
        try {
            if (material instanceof PrivateKeyMaterial pkm) {
                return Pems.write(new JcaPKCS8Generator(pkm.privateKey(), null));
            }
            return Pems.write(material.publicKey());
        } catch (IOException e) {
            throw new IllegalStateException("Unable to PEM encode key: " + getIdentityHex(), e);
        }
    }

    @Override
    public String toString() {
        return "EcdsaKey[" + (isPrivate() ? "private" : "public") + ", " + getIdentityHex() + "]";
    }

    private KeyPair keyPair() {
        return new KeyPair(material.publicKey(), ((PrivateKeyMaterial) material).privateKey());
    }
}
