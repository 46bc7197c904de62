/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

/**
 * The key material is absent, is not an elliptic curve key, or has no valid public point
 *
 * @author hal.hildebrand
 *
 */
public class InvalidKeyMaterialException extends KeyException {
    private static final long serialVersionUID = 6781940281375923346L;

    public InvalidKeyMaterialException(final String message) {
        super(message);
    }

    public InvalidKeyMaterialException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
