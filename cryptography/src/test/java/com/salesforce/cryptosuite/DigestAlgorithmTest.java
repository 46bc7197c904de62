/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 *
 */
public class DigestAlgorithmTest {

    @Test
    public void sha256() {
        var digest = DigestAlgorithm.SHA2_256.hashOf("abc".getBytes(StandardCharsets.UTF_8));
        assertEquals(DigestAlgorithm.SHA2_256.digestLength(), digest.length);
        assertArrayEquals(Hex.decode("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad"), digest);
    }

    @Test
    public void partialBuffer() {
        var bytes = "abcdef".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(DigestAlgorithm.SHA2_256.hashOf("abc".getBytes(StandardCharsets.UTF_8)),
                          DigestAlgorithm.SHA2_256.hashOf(bytes, 3));
    }
}
