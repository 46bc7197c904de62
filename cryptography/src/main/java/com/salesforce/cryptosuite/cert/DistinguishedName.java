/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.cryptosuite.cert;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;

/**
 * An X.500 distinguished name, parsed from either of the two textual forms in
 * common use:
 * <ul>
 * <li>RFC 2253 (LDAP), e.g. <code>CN=node,O=Org</code>. The rightmost RDN is
 * the most significant.</li>
 * <li>OpenSSL one line, e.g. <code>/O=Org/CN=node</code>. The leftmost RDN is
 * the most significant. A <code>/</code> inside a value is escaped as
 * <code>\/</code>.</li>
 * </ul>
 * Both of the examples above denote the same name.
 *
 * @author hal.hildebrand
 *
 */
public class DistinguishedName {

    public static DistinguishedName parse(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Distinguished name is required");
        }
        final String trimmed = name.trim();
        return new DistinguishedName(trimmed.startsWith("/") ? fromOneline(trimmed) : fromLdap(trimmed));
    }

    private static String escapeOneline(final String value) {
        return value.replace("/", "\\/");
    }

    private static X500Name fromLdap(final String name) {
        final RDN[] rdns = IETFUtils.rDNsFromString(name, BCStyle.INSTANCE);
        final RDN[] reversed = new RDN[rdns.length];
        for (int i = 0; i < rdns.length; i++) {
            reversed[i] = rdns[rdns.length - i - 1];
        }
        return new X500Name(BCStyle.INSTANCE, reversed);
    }

    private static X500Name fromOneline(final String name) {
        final X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
        for (String component : splitOneline(name)) {
            final int eq = component.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed RDN: '" + component + "' in: " + name);
            }
            final ASN1ObjectIdentifier oid = BCStyle.INSTANCE.attrNameToOID(component.substring(0, eq).trim());
            builder.addRDN(oid, component.substring(eq + 1));
        }
        return builder.build();
    }

    private static List<String> splitOneline(final String name) {
        final List<String> components = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        for (int i = 1; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (c == '\\' && i + 1 < name.length() && name.charAt(i + 1) == '/') {
                current.append('/');
                i++;
            } else if (c == '/') {
                components.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        components.add(current.toString());
        if (components.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Empty RDN in: " + name);
        }
        return components;
    }

    private final X500Name x500Name;

    public DistinguishedName(final X500Name name) {
        this.x500Name = name;
    }

    public byte[] getEncoded() {
        try {
            return x500Name.getEncoded();
        } catch (final IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public X500Name getX500Name() {
        return x500Name;
    }

    /**
     * @return the name in RFC 2253 order, most significant RDN last
     */
    public String toLdap() {
        final RDN[] rdns = x500Name.getRDNs();
        final StringBuilder buf = new StringBuilder();
        for (int i = rdns.length - 1; i >= 0; i--) {
            appendRdn(buf, rdns[i], false);
            if (i > 0) {
                buf.append(',');
            }
        }
        return buf.toString();
    }

    /**
     * @return the name in OpenSSL one line form, most significant RDN first
     */
    public String toOneline() {
        final StringBuilder buf = new StringBuilder();
        for (RDN rdn : x500Name.getRDNs()) {
            buf.append('/');
            appendRdn(buf, rdn, true);
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        return toOneline();
    }

    private void appendRdn(final StringBuilder buf, final RDN rdn, final boolean oneline) {
        final AttributeTypeAndValue[] atvs = rdn.getTypesAndValues();
        for (int j = 0; j < atvs.length; j++) {
            if (j > 0) {
                buf.append('+');
            }
            final String type = BCStyle.INSTANCE.oidToDisplayName(atvs[j].getType());
            final String value = IETFUtils.valueToString(atvs[j].getValue());
            buf.append(type == null ? atvs[j].getType().getId() : type)
               .append('=')
               .append(oneline ? escapeOneline(value) : value);
        }
    }
}
