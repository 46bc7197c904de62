/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;

/**
 * Enumerations of digest algorithms
 *
 * @author hal.hildebrand
 */
public enum DigestAlgorithm {

    SHA2_256 {
        @Override
        public String algorithmName() {
            return "SHA-256";
        }

        @Override
        public int digestLength() {
            return 32;
        }

        @Override
        public String ecdsaSignatureInstanceName() {
            return "SHA256withECDSA";
        }
    };

    private static final ThreadLocal<DigestCache> MESSAGE_DIGEST = ThreadLocal.withInitial(() -> new DigestCache());

    abstract public String algorithmName();

    abstract public int digestLength();

    /**
     * @return the JCA signature name for ECDSA over this digest
     */
    abstract public String ecdsaSignatureInstanceName();

    public byte[] hashOf(byte[] bytes) {
        return hashOf(bytes, bytes.length);
    }

    public byte[] hashOf(byte[] bytes, int len) {
        MessageDigest md = lookupJCA();
        md.reset();
        md.update(bytes, 0, len);
        return md.digest();
    }

    protected MessageDigest createJCA() {
        try {
            return MessageDigest.getInstance(algorithmName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to retrieve " + algorithmName()
            + " Message DigestAlgorithm instance", e);
        }
    }

    private MessageDigest lookupJCA() {
        return MESSAGE_DIGEST.get().lookup(this);
    }

    private static class DigestCache {
        private final Map<DigestAlgorithm, MessageDigest> cache = new HashMap<>();

        public MessageDigest lookup(DigestAlgorithm da) {
            return cache.computeIfAbsent(da, k -> k.createJCA());
        }
    }
}
