/*
 * Copyright 2015 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.midonet.netaddr;

import com.google.common.base.CharMatcher;

import org.apache.commons.lang.StringUtils;

import org.midonet.netaddr.AddressException.Kind;

/**
 * Text grammar for IPv4 and IPv6 addresses.
 *
 * IPv4 is four dot separated decimal octets; leading zeros are read as
 * decimal. IPv6 is up to eight colon separated groups of one to four hex
 * digits with at most one "::", an optional trailing dotted quad filling the
 * last four bytes, and an optional "%zone" suffix. Inside the dotted quad of
 * an IPv6 address leading zeros are refused, since some parsers read them as
 * octal.
 */
final class AddressParser {

    static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private AddressParser() {}

    static Address parse(String input) {
        if (input == null)
            throw new AddressException(Kind.FORMAT,
                                       "Invalid IP address format: null");
        if (input.indexOf(':') >= 0)
            return parseIPv6(input);
        if (input.indexOf('.') >= 0)
            return parseIPv4(input);
        throw new AddressException(Kind.FORMAT,
                                   "Invalid IP address format: " + input);
    }

    static Address parseIPv4(String input) {
        if (input.indexOf('%') >= 0)
            throw new AddressException(Kind.FORMAT,
                "IPv4 address cannot have a zone: " + input);

        String[] parts = StringUtils.splitPreserveAllTokens(input, '.');
        if (parts.length != 4)
            throw new AddressException(Kind.FORMAT,
                                       "Invalid IPv4 address: " + input);

        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || !DIGITS.matchesAllOf(part))
                throw new AddressException(Kind.LEXICAL,
                    "Invalid IPv4 address component: " + part);
            int value = decimal(part);
            if (value > 255)
                throw new AddressException(Kind.RANGE,
                    "Invalid IPv4 address component: " + part);
            bytes[i] = (byte) value;
        }
        return Address.fromIPv4Bytes(bytes);
    }

    static Address parseIPv6(String input) {
        String s = input;
        String zone = null;
        int percent = s.indexOf('%');
        if (percent >= 0) {
            zone = s.substring(percent + 1);
            s = s.substring(0, percent);
            if (zone.isEmpty())
                throw new AddressException(Kind.FORMAT,
                    "Zone must be a non-empty string: " + input);
        }

        byte[] ip = new byte[16];
        int ellipsis = -1;
        int pos = 0;
        int end = s.length();

        if (end >= 2 && s.charAt(0) == ':' && s.charAt(1) == ':') {
            ellipsis = 0;
            pos = 2;
            if (pos == end)
                return Address.fromIPv6Bytes(ip).withZone(zone);
        }

        int i = 0;
        while (i < 16) {
            int off = pos;
            int acc = 0;
            for (; off < end; off++) {
                int digit = hexDigit(s.charAt(off));
                if (digit < 0)
                    break;
                acc = (acc << 4) + digit;
                if (off - pos > 3)
                    throw new AddressException(Kind.LEXICAL,
                        "Each group must have 4 or fewer digits: " + input);
                if (acc > 0xffff)
                    throw new AddressException(Kind.RANGE,
                        "IPv6 field has value >= 2^16: " + input);
            }
            if (off == pos)
                throw new AddressException(Kind.LEXICAL,
                    "Each colon-separated field must have at least one digit: "
                    + input);

            if (off < end && s.charAt(off) == '.') {
                if (ellipsis < 0 && i != 12)
                    throw new AddressException(Kind.STRUCTURE,
                        "Embedded IPv4 address must replace the final 2 " +
                        "fields of the address: " + input);
                if (i + 4 > 16)
                    throw new AddressException(Kind.STRUCTURE,
                        "Too many hex fields to fit an embedded IPv4 at the " +
                        "end of the address: " + input);
                parseEmbeddedIPv4(s.substring(pos), ip, i);
                pos = end;
                i += 4;
                break;
            }

            ip[i] = (byte) (acc >> 8);
            ip[i + 1] = (byte) acc;
            i += 2;

            pos = off;
            if (pos == end)
                break;

            if (s.charAt(pos) != ':')
                throw new AddressException(Kind.LEXICAL,
                    "Unexpected character, expected colon: " + input);
            if (pos + 1 == end)
                throw new AddressException(Kind.STRUCTURE,
                    "Colon must be followed by more characters: " + input);
            pos++;

            if (s.charAt(pos) == ':') {
                if (ellipsis >= 0)
                    throw new AddressException(Kind.STRUCTURE,
                        "Multiple :: in address: " + input);
                ellipsis = i;
                pos++;
                if (pos == end)
                    break;
            }
        }

        if (pos != end)
            throw new AddressException(Kind.STRUCTURE,
                "Trailing garbage after address: " + input);

        if (i < 16) {
            if (ellipsis < 0)
                throw new AddressException(Kind.STRUCTURE,
                    "Address string too short: " + input);
            int n = 16 - i;
            for (int j = i - 1; j >= ellipsis; j--)
                ip[j + n] = ip[j];
            for (int j = ellipsis; j < ellipsis + n; j++)
                ip[j] = 0;
        } else if (ellipsis >= 0) {
            throw new AddressException(Kind.STRUCTURE,
                "The :: must expand to at least one field of zeros: " + input);
        }

        return Address.fromIPv6Bytes(ip).withZone(zone);
    }

    /**
     * Parses the dotted quad tail of an IPv6 address into four bytes of
     * {@code ip} starting at {@code offset}.
     */
    private static void parseEmbeddedIPv4(String s, byte[] ip, int offset) {
        String[] parts = StringUtils.splitPreserveAllTokens(s, '.');
        if (parts.length != 4)
            throw new AddressException(Kind.STRUCTURE,
                "Invalid embedded IPv4 address: " + s);
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty())
                throw new AddressException(Kind.LEXICAL,
                    "Empty octet in embedded IPv4 address: " + s);
            if (!DIGITS.matchesAllOf(part))
                throw new AddressException(Kind.LEXICAL,
                    "Invalid octet in embedded IPv4 address: " + part);
            if (part.length() > 1 && part.charAt(0) == '0')
                throw new AddressException(Kind.LEXICAL,
                    "Leading zero in embedded IPv4 octet: " + part);
            int value = decimal(part);
            if (value > 255)
                throw new AddressException(Kind.RANGE,
                    "Invalid octet in embedded IPv4 address: " + part);
            ip[offset + i] = (byte) value;
        }
    }

    /**
     * Parses a non-empty string of ASCII digits, saturating just above the
     * largest value any caller accepts so long inputs cannot overflow.
     */
    static int decimal(String digits) {
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            value = value * 10 + (digits.charAt(i) - '0');
            if (value > 0xffff)
                return 0x10000;
        }
        return value;
    }

    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9')
            return c - '0';
        if (c >= 'a' && c <= 'f')
            return c - 'a' + 10;
        if (c >= 'A' && c <= 'F')
            return c - 'A' + 10;
        return -1;
    }
}
