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

package org.midonet.data;

import org.midonet.netaddr.AddressException.Kind;

import static junitparams.JUnitParamsRunner.$;

/**
 * Provides address, prefix and address/port texts for parsing tests.
 */
public class AddressProvider {

    /** input, expected canonical form */
    public static Object[] validAddresses() {
        return $(
                $("0.0.0.0", "0.0.0.0"),
                $("127.0.0.1", "127.0.0.1"),
                $("8.8.8.8", "8.8.8.8"),
                $("192.168.0.01", "192.168.0.1"),
                $("010.001.000.001", "10.1.0.1"),
                $("::", "::"),
                $("::1", "::1"),
                $("1::", "1::"),
                $("1:2:3:4:5:6:7:8", "1:2:3:4:5:6:7:8"),
                $("2001:DB8::1", "2001:db8::1"),
                $("::1:2:3:4:5", "::1:2:3:4:5"),
                $("::ffff:192.168.1.1", "::ffff:192.168.1.1"),
                $("::ffff:0:0", "::ffff:0.0.0.0"),
                $("0:0:0:0:0:ffff:192.168.1.1", "::ffff:192.168.1.1"),
                $("::ffff:0102:0304", "::ffff:1.2.3.4"),
                $("1:2:3:4:5:6:1.2.3.4", "1:2:3:4:5:6:102:304"),
                $("::1.2.3.4", "::102:304"),
                $("fe80::%eth0", "fe80::%eth0"),
                $("::1%zone", "::1%zone"),
                $("::%1", "::%1"),
                $("2001:db8::%lo", "2001:db8::%lo"),
                $("fe80::1ff:fe23:4567:890a", "fe80::1ff:fe23:4567:890a"),
                $("2001:db8:85a3:8d3:1319:8a2e:370:7348",
                  "2001:db8:85a3:8d3:1319:8a2e:370:7348"),
                $("0000:0000:0000:0000:0000:0000:0000:0001", "::1"),
                // Only the first zero run is compressed.
                $("1:0:2:0:0:0:0:3", "1::2:0:0:0:0:3"),
                $("2001:db8:0:0:1:0:0:1", "2001:db8::1:0:0:1"),
                $("1:2:3:4:5:6:7:0", "1:2:3:4:5:6:7::")
        );
    }

    /** input, expected error kind */
    public static Object[] invalidAddresses() {
        return $(
                $("", Kind.FORMAT),
                $("invalid-address", Kind.FORMAT),
                $("1.1.1.1.", Kind.FORMAT),
                $("1.1.1", Kind.FORMAT),
                $("192.168.1.1%eth0", Kind.FORMAT),
                $(".192.168.1", Kind.LEXICAL),
                $("1.2..3.4", Kind.FORMAT),
                $("1.2.3.-4", Kind.LEXICAL),
                $("1.2.3.4a", Kind.LEXICAL),
                $("255.255.255.256", Kind.RANGE),
                $("192.168.0.300", Kind.RANGE),
                $("999.999.999.999", Kind.RANGE),
                $("1.2.3.99999999999", Kind.RANGE),
                $("fe80::1%", Kind.FORMAT),
                $(":::", Kind.LEXICAL),
                $(":::1", Kind.LEXICAL),
                $("::g1", Kind.LEXICAL),
                $("abcd:1234::xyz", Kind.LEXICAL),
                $("12345::1", Kind.LEXICAL),
                $("1:2", Kind.STRUCTURE),
                $("1:", Kind.STRUCTURE),
                $("1:2:3:4:5:6:7:8:9", Kind.STRUCTURE),
                $("1:2:3::4:5:6:7:8", Kind.STRUCTURE),
                $("2001:db8:::1", Kind.LEXICAL),
                $("1::2::3", Kind.STRUCTURE),
                $("2001:db8:85a3:8d3:1319:8a2e:370:7348::", Kind.STRUCTURE),
                $("192.168.1.1::", Kind.STRUCTURE),
                $("2001:db8::/64", Kind.LEXICAL),
                $("::ffff:256.256.256.256", Kind.RANGE),
                $("::ffff:192.168.1", Kind.STRUCTURE),
                $("::ffff:01.2.3.4", Kind.LEXICAL),
                $("::ffff:1..3.4", Kind.LEXICAL),
                $("1:2:3:4:5:1.2.3.4", Kind.STRUCTURE),
                $("1:2:3:4:5:6:7:1.2.3.4", Kind.STRUCTURE),
                $("1:2:3:4:5:6:7::1.2.3.4", Kind.STRUCTURE)
        );
    }

    public static Object[] validPrefixes() {
        return $(
                $("0.0.0.0/0"),
                $("10.10.10.10/16"),
                $("192.168.1.0/24"),
                $("255.255.255.255/32"),
                $("::/0"),
                $("2001:db8::/32"),
                $("fe80::1/64"),
                $("::ffff:10.0.0.0/104"),
                $("ffff:ffff:ffff:ffff:ffff:ffff:ffff:ffff/128")
        );
    }

    /** input, expected error kind */
    public static Object[] invalidPrefixes() {
        return $(
                $("invalid-input", Kind.FORMAT),
                $("1.1.1.1", Kind.FORMAT),
                $("1.1.1.1/", Kind.FORMAT),
                $("1.1.1.1/8/8", Kind.FORMAT),
                $("1.1.1.1_32", Kind.FORMAT),
                $("/32", Kind.FORMAT),
                $("fe80::1%eth0/64", Kind.FORMAT),
                $("1.1.1.1/foo", Kind.LEXICAL),
                $("192.168.1.0/notanumber", Kind.LEXICAL),
                $("1.1.1.1/-1", Kind.LEXICAL),
                $("1.1.1.1/33", Kind.RANGE),
                $("::/129", Kind.RANGE),
                $("999.999.999.999/24", Kind.RANGE),
                $("1.1.1/32", Kind.FORMAT)
        );
    }

    public static Object[] validAddressPorts() {
        return $(
                $("192.168.1.1:8080"),
                $("0.0.0.0:0"),
                $("255.255.255.255:65535"),
                $("[::1]:8080"),
                $("[2001:db8::1]:443"),
                $("[fe80::1%eth0]:22")
        );
    }

    /** input, expected error kind */
    public static Object[] invalidAddressPorts() {
        return $(
                $("invalid-input", Kind.FORMAT),
                $("2001:db8::1:443", Kind.FORMAT),
                $("::1", Kind.FORMAT),
                $("[::1", Kind.FORMAT),
                $("[::1]", Kind.FORMAT),
                $("[::1]80", Kind.FORMAT),
                $(":80", Kind.FORMAT),
                $("192.168.1.1:notaport", Kind.LEXICAL),
                $("192.168.1.1:", Kind.LEXICAL),
                $("192.168.1.1:-1", Kind.LEXICAL),
                $("[::1]:", Kind.LEXICAL),
                $("192.168.1.1:65536", Kind.RANGE),
                $("[::1]:99999999999", Kind.RANGE),
                $("256.1.1.1:80", Kind.RANGE),
                $("[1::2::3]:80", Kind.STRUCTURE)
        );
    }
}
