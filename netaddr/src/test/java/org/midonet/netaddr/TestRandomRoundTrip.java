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

import java.util.Arrays;
import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Checks codecs and address arithmetic laws on seeded random values.
 */
public class TestRandomRoundTrip {

    private static final int ROUNDS = 2000;

    private final Random random = new Random(0x5eedL);

    private Address randomAddress() {
        byte[] bytes = new byte[random.nextBoolean() ? 4 : 16];
        random.nextBytes(bytes);
        // Runs of zero groups are rare in random data, force some.
        if (bytes.length == 16 && random.nextBoolean()) {
            int from = random.nextInt(16);
            int to = from + random.nextInt(16 - from);
            for (int i = from; i <= to; i++)
                bytes[i] = 0;
        }
        return Address.fromBytes(bytes);
    }

    @Test
    public void testAddresses() {
        for (int i = 0; i < ROUNDS; i++) {
            Address address = randomAddress();
            if (address.isIPv6() && random.nextInt(4) == 0)
                address = address.withZone("eth" + random.nextInt(10));

            assertEquals(address, Address.parse(address.toString()));
            assertEquals(address,
                         Address.parse(address.toExpandedString()));
            assertEquals(address.withZone(null),
                         Address.unmarshalBinary(address.marshalBinary()));
        }
    }

    @Test
    public void testPrefixes() {
        for (int i = 0; i < ROUNDS; i++) {
            Address address = randomAddress();
            AddressPrefix prefix = AddressPrefix.from(
                address, random.nextInt(address.bitLength() + 1));

            assertEquals(prefix, AddressPrefix.parse(prefix.toString()));
            assertEquals(prefix,
                         AddressPrefix.unmarshalBinary(prefix.marshalBinary()));
            assertTrue(prefix.contains(address));
            assertTrue(prefix.getRanges().isInside(address));
        }
    }

    @Test
    public void testAddressPorts() {
        for (int i = 0; i < ROUNDS; i++) {
            Address address = randomAddress();
            if (address.isIPv4MappedIPv6())
                continue;
            AddressPort addrPort =
                AddressPort.from(address, random.nextInt(AddressPort.MAX_PORT + 1));

            assertEquals(addrPort, AddressPort.parse(addrPort.toString()));
            assertEquals(addrPort,
                         AddressPort.unmarshalBinary(addrPort.marshalBinary()));
        }
    }

    @Test
    public void testMaskIsIdempotent() {
        for (int i = 0; i < ROUNDS; i++) {
            Address address = randomAddress();
            int bits = random.nextInt(address.bitLength() + 1);

            Address masked = address.mask(bits);
            assertEquals(masked, masked.mask(bits));
        }
    }

    @Test
    public void testNextAndPreviousAreInverse() {
        for (int i = 0; i < ROUNDS; i++) {
            Address address = randomAddress();
            if (i % 10 == 0)
                address = Address.fromBytes(new byte[address.toBytes().length]);
            else if (i % 10 == 1)
                address = Address.fromBytes(allOnes(address.toBytes().length));

            if (address.isUnspecified())
                assertFalse(address.previous().isValid());
            else
                assertEquals(address, address.previous().next());

            if (Arrays.equals(address.toBytes(),
                              allOnes(address.toBytes().length)))
                assertFalse(address.next().isValid());
            else
                assertEquals(address, address.next().previous());
        }
    }

    @Test
    public void testOverlapsIsSymmetric() {
        for (int i = 0; i < ROUNDS; i++) {
            Address a = randomAddress();
            Address b = random.nextInt(4) == 0 ? randomAddress() : a;
            AddressPrefix p = AddressPrefix.from(
                a, random.nextInt(a.bitLength() + 1));
            AddressPrefix q = AddressPrefix.from(
                b, random.nextInt(b.bitLength() + 1));

            assertEquals(p.overlaps(q), q.overlaps(p));
            assertTrue(p.overlaps(p));
        }
    }

    private static byte[] allOnes(int length) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) 0xff);
        return bytes;
    }
}
