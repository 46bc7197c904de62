/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.cert;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.util.io.pem.PemObjectGenerator;

/**
 * PEM text encoding and decoding
 *
 * @author hal.hildebrand
 *
 */
public final class Pems {

    /**
     * @return the first object in the PEM text, or null if there is none
     */
    public static Object read(String pem) throws IOException {
        try (final PEMParser pemParser = new PEMParser(new StringReader(pem))) {
            return pemParser.readObject();
        }
    }

    /**
     * Encode a certificate, certification request, key, or any other object the
     * Bouncy Castle PEM writer understands
     */
    public static String write(Object object) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(sw)) {
            if (object instanceof PemObjectGenerator generator) {
                writer.writeObject(generator);
            } else {
                writer.writeObject(object);
            }
            writer.flush();
        }
        return sw.toString();
    }

    private Pems() {
    }
}
