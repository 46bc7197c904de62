/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite;

import java.security.Provider;
import java.security.Security;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The generic sacrifice to the JCE provider gods. Installs the Bouncy Castle
 * provider once per class loader.
 *
 * @author hal.hildebrand
 *
 */
public final class ProviderUtils {

    static final String PROVIDER_NAME_BC = BouncyCastleProvider.PROVIDER_NAME;

    private static final Logger   log = LoggerFactory.getLogger(ProviderUtils.class);
    private static final Provider PROVIDER_BC;

    static {
        PROVIDER_BC = setup();
    }

    public static Provider getProviderBC() {
        return PROVIDER_BC;
    }

    static boolean isProviderBC(Provider p) {
        return p instanceof BouncyCastleProvider;
    }

    private static Provider setup() {
        Provider bc = Security.getProvider(PROVIDER_NAME_BC);
        if (isProviderBC(bc)) {
            log.debug("Using installed JCA provider: {} {}", bc.getName(), bc.getVersionStr());
            return bc;
        }
        bc = new BouncyCastleProvider();
        Security.addProvider(bc);
        log.info("Installed JCA provider: {} {}", bc.getName(), bc.getVersionStr());
        return bc;
    }

    private ProviderUtils() {
    }
}
