/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;

import org.bouncycastle.jcajce.provider.asymmetric.util.EC5Util;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import com.salesforce.cryptosuite.ProviderUtils;

/**
 * Point arithmetic and encoding for elliptic curve keys
 *
 * @author hal.hildebrand
 *
 */
final class EcPoints {
    static final byte UNCOMPRESSED = 0x04;

    /**
     * The public key <code>d * G</code> for the private scalar d
     */
    static ECPublicKey derivePublicKey(ECPrivateKey privateKey) throws GeneralSecurityException {
        final ECParameterSpec params = privateKey.getParams();
        final var bcSpec = EC5Util.convertSpec(params);
        final var q = new FixedPointCombMultiplier().multiply(bcSpec.getG(), privateKey.getS()).normalize();
        final var w = new ECPoint(q.getAffineXCoord().toBigInteger(), q.getAffineYCoord().toBigInteger());
        final var keyFactory = KeyFactory.getInstance("EC", ProviderUtils.getProviderBC());
        return (ECPublicKey) keyFactory.generatePublic(new ECPublicKeySpec(w, params));
    }

    /**
     * @return the byte length of a coordinate: the bit length of the curve order,
     *         rounded up to whole bytes
     */
    static int coordinateLength(ECParameterSpec params) {
        return (params.getOrder().bitLength() + 7) / 8;
    }

    /**
     * @return the byte length of a field element
     */
    static int fieldLength(ECParameterSpec params) {
        return (params.getCurve().getField().getFieldSize() + 7) / 8;
    }

    /**
     * @return true if the public point is on its curve, in the prime order
     *         subgroup, and not the point at infinity
     */
    static boolean isValid(ECPublicKey publicKey) {
        if (publicKey.getParams() == null || ECPoint.POINT_INFINITY.equals(publicKey.getW())) {
            return false;
        }
        try {
            return EC5Util.convertPoint(publicKey.getParams(), publicKey.getW()).isValid();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * SEC 1 uncompressed encoding: <code>0x04 || X || Y</code>, each coordinate
     * left padded with zeros to the coordinate length
     */
    static byte[] uncompressed(ECPublicKey publicKey) {
        final int length = coordinateLength(publicKey.getParams());
        final ECPoint w = publicKey.getW();
        final byte[] encoded = new byte[1 + 2 * length];
        encoded[0] = UNCOMPRESSED;
        copy(w.getAffineX(), length, encoded, 1);
        copy(w.getAffineY(), length, encoded, 1 + length);
        return encoded;
    }

    private static void copy(BigInteger coordinate, int length, byte[] dest, int offset) {
        final byte[] bytes = BigIntegers.asUnsignedByteArray(length, coordinate);
        System.arraycopy(bytes, 0, dest, offset, length);
    }

    private EcPoints() {
    }
}
