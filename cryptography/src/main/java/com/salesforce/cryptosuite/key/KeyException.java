/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

/**
 * Root of the failures raised by keys
 *
 * @author hal.hildebrand
 *
 */
public class KeyException extends RuntimeException {
    private static final long serialVersionUID = -4302281160938455102L;

    public KeyException(final String message) {
        super(message);
    }

    public KeyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
