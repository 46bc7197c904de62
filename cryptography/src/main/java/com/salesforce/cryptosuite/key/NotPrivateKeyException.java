/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

/**
 * An operation requiring the private scalar was invoked on a public only key
 *
 * @author hal.hildebrand
 *
 */
public class NotPrivateKeyException extends KeyException {
    private static final long serialVersionUID = -1559807325216418037L;

    public NotPrivateKeyException(final String message) {
        super(message);
    }
}
