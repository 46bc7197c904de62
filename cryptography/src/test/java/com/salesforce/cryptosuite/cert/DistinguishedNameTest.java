/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.cert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 *
 */
public class DistinguishedNameTest {

    @Test
    public void ldapAndOnelineAgree() {
        var ldap = DistinguishedName.parse("CN=node0,OU=peers,O=Org");
        var oneline = DistinguishedName.parse("/O=Org/OU=peers/CN=node0");
        assertEquals(ldap.getX500Name(), oneline.getX500Name());
        assertEquals("/O=Org/OU=peers/CN=node0", ldap.toOneline());
        assertEquals("CN=node0,OU=peers,O=Org", oneline.toLdap());
    }

    @Test
    public void mostSignificantFirstInDer() {
        var dn = DistinguishedName.parse("CN=node0,O=Org");
        var rdns = dn.getX500Name().getRDNs();
        assertEquals(BCStyle.O, rdns[0].getFirst().getType());
        assertEquals(BCStyle.CN, rdns[1].getFirst().getType());
    }

    @Test
    public void escapedSlash() {
        var dn = DistinguishedName.parse("/CN=a\\/b");
        assertEquals("a/b", IETFUtils.valueToString(dn.getX500Name().getRDNs(BCStyle.CN)[0].getFirst().getValue()));
        assertEquals("/CN=a\\/b", dn.toOneline());
    }

    @Test
    public void single() {
        assertEquals("/CN=self", DistinguishedName.parse("/CN=self").toOneline());
        assertEquals("/CN=self", DistinguishedName.parse("CN=self").toOneline());
    }

    @Test
    public void malformed() {
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse(null));
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse("/"));
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse("/CN"));
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse("/CN=a//O=b"));
        assertThrows(IllegalArgumentException.class, () -> DistinguishedName.parse("/XYZZY=plugh"));
    }
}
