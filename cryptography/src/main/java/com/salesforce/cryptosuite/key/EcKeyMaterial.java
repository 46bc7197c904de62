/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;

/**
 * The key material held by an {@link EcdsaKey}: either a public point alone, or
 * a private scalar together with its public point. Validation happens when the
 * key is constructed.
 *
 * @author hal.hildebrand
 *
 */
public interface EcKeyMaterial {

    record PrivateKeyMaterial(ECPrivateKey privateKey, ECPublicKey publicKey) implements EcKeyMaterial {

        // Bouncy Castle prints the private scalar
        @Override
        public String toString() {
            return "PrivateKeyMaterial[" + publicKey + "]";
        }
    }

    record PublicKeyMaterial(ECPublicKey publicKey) implements EcKeyMaterial {
    }

    ECPublicKey publicKey();
}
