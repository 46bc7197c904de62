/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

/**
 * Building, signing or encoding a certificate failed
 *
 * @author hal.hildebrand
 *
 */
public class CertificateGenerationException extends KeyException {
    private static final long serialVersionUID = 2883306412471002317L;

    public CertificateGenerationException(final String message) {
        super(message);
    }

    public CertificateGenerationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
