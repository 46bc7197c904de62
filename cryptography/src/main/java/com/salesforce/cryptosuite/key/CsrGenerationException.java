/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

/**
 * Building, signing or encoding a certification request failed
 *
 * @author hal.hildebrand
 *
 */
public class CsrGenerationException extends KeyException {
    private static final long serialVersionUID = 8212069973319820514L;

    public CsrGenerationException(final String message) {
        super(message);
    }

    public CsrGenerationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
