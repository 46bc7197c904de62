/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.key;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Parameters of a self signed certificate. Only the subject and the clock vary;
 * the serial number and the validity window are fixed, as these certificates
 * identify short lived, ephemeral keys rather than being issued by a CA.
 *
 * @author hal.hildebrand
 *
 */
public record SelfSignedParameters(String subject, Clock clock) {

    public static final Duration   BACKDATE      = Duration.ofSeconds(5);
    public static final Duration   LIFETIME      = Duration.ofSeconds(60);
    public static final BigInteger SERIAL_NUMBER = BigInteger.valueOf(4);

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Clock  clock   = Clock.systemUTC();
        private String subject = Key.DEFAULT_SELF_SIGNED_SUBJECT;

        public SelfSignedParameters build() {
            return new SelfSignedParameters(subject, clock);
        }

        public Builder setClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder setSubject(String subject) {
            this.subject = subject;
            return this;
        }
    }
}
