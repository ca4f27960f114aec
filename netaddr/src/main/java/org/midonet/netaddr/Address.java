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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedBytes;

import org.apache.commons.lang.StringUtils;

import org.midonet.netaddr.AddressException.Kind;

/**
 * An immutable IPv4 or IPv6 address.
 *
 * The address is held as its 4 or 16 big-endian bytes. IPv6 addresses may
 * also carry a zone naming the scope they belong to; a 4-byte address never
 * has one. Any other byte length is the invalid address, the value returned
 * by operations that have no meaningful answer (e.g. the successor of
 * 255.255.255.255). Use {@link #isValid()} to tell it apart.
 *
 * Ordering through {@link #compareTo(Address)} looks at the bytes only, so
 * it is inconsistent with {@link #equals(Object)} for addresses that differ
 * only in their zone.
 */
public final class Address implements Comparable<Address> {

    public static final int IPV4_BITS = 32;
    public static final int IPV6_BITS = 128;

    static final String INVALID_STRING = "invalid IP";

    private static final Address INVALID = new Address(new byte[0], null);

    private static final Comparator<byte[]> BYTE_ORDER =
        UnsignedBytes.lexicographicalComparator();

    private final byte[] bytes;
    private final String zone;
    private String string = null; // not final to allow lazy init

    private Address(byte[] bytes, String zone) {
        this.bytes = bytes;
        this.zone = (bytes.length == 16 && zone != null && !zone.isEmpty())
                    ? zone : null;
    }

    /**
     * Builds an IPv4 address from exactly four bytes.
     */
    public static Address fromIPv4Bytes(byte[] bytes) {
        Preconditions.checkNotNull(bytes);
        if (bytes.length != 4)
            throw new AddressException(Kind.CODEC,
                "IPv4 address must be exactly 4 bytes.");
        return new Address(bytes.clone(), null);
    }

    /**
     * Builds an IPv6 address, without zone, from exactly sixteen bytes.
     */
    public static Address fromIPv6Bytes(byte[] bytes) {
        Preconditions.checkNotNull(bytes);
        if (bytes.length != 16)
            throw new AddressException(Kind.CODEC,
                "IPv6 address must be exactly 16 bytes.");
        return new Address(bytes.clone(), null);
    }

    /**
     * Builds an IPv4 or IPv6 address depending on the length of the array.
     * Lengths other than 4 and 16 give the invalid address.
     */
    public static Address fromBytes(byte[] bytes) {
        Preconditions.checkNotNull(bytes);
        if (bytes.length != 4 && bytes.length != 16)
            return INVALID;
        return new Address(bytes.clone(), null);
    }

    public static Address invalid() {
        return INVALID;
    }

    /** 0.0.0.0 */
    public static Address ipv4Unspecified() {
        return new Address(new byte[4], null);
    }

    /** :: */
    public static Address ipv6Unspecified() {
        return new Address(new byte[16], null);
    }

    /** ::1 */
    public static Address ipv6Loopback() {
        byte[] bytes = new byte[16];
        bytes[15] = 0x01;
        return new Address(bytes, null);
    }

    /** ff02::1 */
    public static Address ipv6LinkLocalAllNodes() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0xff;
        bytes[1] = 0x02;
        bytes[15] = 0x01;
        return new Address(bytes, null);
    }

    /** ff02::2 */
    public static Address ipv6LinkLocalAllRouters() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0xff;
        bytes[1] = 0x02;
        bytes[15] = 0x02;
        return new Address(bytes, null);
    }

    /**
     * Parses an address in dotted decimal ("192.168.0.1") or colon
     * separated hex ("2001:db8::1", "fe80::1%eth0", "::ffff:1.2.3.4")
     * notation.
     *
     * @throws AddressException if the text is not a valid address.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address parse(String input) {
        return AddressParser.parse(input);
    }

    /**
     * Like {@link #parse(String)}, for call sites where a failure is a
     * programming error, such as hard-coded constants.
     */
    public static Address mustParse(String input) {
        try {
            return parse(input);
        } catch (AddressException e) {
            throw new IllegalArgumentException(
                "Failed to parse address: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes the raw 4 or 16 byte form written by {@link #marshalBinary()}.
     */
    public static Address unmarshalBinary(byte[] data) {
        Preconditions.checkNotNull(data);
        if (data.length != 4 && data.length != 16)
            throw new AddressException(Kind.CODEC,
                "Invalid binary address length: " + data.length);
        return new Address(data.clone(), null);
    }

    /**
     * Decodes the text form written by {@link #marshalText()}.
     */
    public static Address unmarshalText(String text) {
        return parse(text);
    }

    public boolean isValid() {
        return bytes.length == 4 || bytes.length == 16;
    }

    public boolean isIPv4() {
        return bytes.length == 4;
    }

    public boolean isIPv6() {
        return bytes.length == 16;
    }

    /**
     * True for a 16-byte address of the form ::ffff:a.b.c.d.
     */
    public boolean isIPv4MappedIPv6() {
        if (bytes.length != 16)
            return false;
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0)
                return false;
        }
        return bytes[10] == (byte) 0xff && bytes[11] == (byte) 0xff;
    }

    /**
     * 32 for IPv4, 128 for IPv6, 0 for the invalid address.
     */
    public int bitLength() {
        switch (bytes.length) {
            case 4: return IPV4_BITS;
            case 16: return IPV6_BITS;
            default: return 0;
        }
    }

    /**
     * The zone, or the empty string if the address has none.
     */
    public String getZone() {
        return zone == null ? "" : zone;
    }

    public boolean hasZone() {
        return zone != null;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public byte[] toIPv4Bytes() {
        if (!isIPv4())
            throw new IllegalStateException("Address is not IPv4.");
        return bytes.clone();
    }

    /**
     * The 16 byte form of the address; IPv4 addresses are returned in
     * their IPv4-mapped form.
     */
    public byte[] toIPv6Bytes() {
        if (isIPv6())
            return bytes.clone();
        if (isIPv4()) {
            byte[] mapped = new byte[16];
            mapped[10] = (byte) 0xff;
            mapped[11] = (byte) 0xff;
            System.arraycopy(bytes, 0, mapped, 12, 4);
            return mapped;
        }
        throw new IllegalStateException("Invalid address.");
    }

    /**
     * Returns a copy of this address with the given zone. Addresses other
     * than IPv6 are returned unchanged; a null or empty zone removes it.
     */
    public Address withZone(String zone) {
        if (!isIPv6())
            return this;
        return new Address(bytes, zone);
    }

    /**
     * Turns an IPv4-mapped IPv6 address into the IPv4 address it embeds.
     * Other addresses are returned unchanged.
     */
    public Address unmap() {
        if (!isIPv4MappedIPv6())
            return this;
        return new Address(Arrays.copyOfRange(bytes, 12, 16), null);
    }

    /**
     * Keeps the top {@code bits} bits of the address and clears the rest.
     * The zone is kept.
     *
     * @throws AddressException of kind RANGE unless
     *         0 &lt;= bits &lt;= bitLength().
     */
    public Address mask(int bits) {
        if (bits < 0 || bits > bitLength())
            throw new AddressException(Kind.RANGE,
                                       "Invalid mask length: " + bits);
        if (!isValid())
            return INVALID;

        byte[] masked = bytes.clone();
        int full = bits / 8;
        int rem = bits % 8;
        if (rem != 0) {
            masked[full] &= (byte) (0xff << (8 - rem));
            full++;
        }
        for (int i = full; i < masked.length; i++)
            masked[i] = 0;
        return new Address(masked, zone);
    }

    /**
     * The network of the given length containing this address, with host
     * bits cleared and without zone.
     */
    public AddressPrefix prefix(int bits) {
        return AddressPrefix.from(mask(bits).withZone(null), bits);
    }

    /**
     * The address one above this one, or the invalid address when this is
     * the highest address of its family.
     */
    public Address next() {
        byte[] b = bytes.clone();
        for (int i = b.length - 1; i >= 0; i--) {
            if (b[i] != (byte) 0xff) {
                b[i]++;
                return new Address(b, zone);
            }
            b[i] = 0;
        }
        return INVALID;
    }

    /**
     * The address one below this one, or the invalid address when this is
     * the lowest address of its family.
     */
    public Address previous() {
        byte[] b = bytes.clone();
        for (int i = b.length - 1; i >= 0; i--) {
            if (b[i] != 0) {
                b[i]--;
                return new Address(b, zone);
            }
            b[i] = (byte) 0xff;
        }
        return INVALID;
    }

    public boolean isUnspecified() {
        if (!isValid())
            return false;
        for (byte b : bytes) {
            if (b != 0)
                return false;
        }
        return true;
    }

    public boolean isLoopback() {
        if (isIPv4())
            return bytes[0] == 127;
        if (isIPv6()) {
            for (int i = 0; i < 15; i++) {
                if (bytes[i] != 0)
                    return false;
            }
            return bytes[15] == 1;
        }
        return false;
    }

    public boolean isMulticast() {
        if (isIPv4())
            return (bytes[0] & 0xf0) == 0xe0;
        if (isIPv6())
            return bytes[0] == (byte) 0xff;
        return false;
    }

    /**
     * 10/8, 172.16/12 and 192.168/16 for IPv4; fc00::/7 for IPv6.
     */
    public boolean isPrivate() {
        if (isIPv4()) {
            int first = Unsigned.unsign(bytes[0]);
            int second = Unsigned.unsign(bytes[1]);
            return first == 10
                   || (first == 172 && second >= 16 && second <= 31)
                   || (first == 192 && second == 168);
        }
        if (isIPv6())
            return (bytes[0] & 0xfe) == 0xfc;
        return false;
    }

    /**
     * 169.254/16 for IPv4; fe80::/10 for IPv6.
     */
    public boolean isLinkLocalUnicast() {
        if (isIPv4())
            return bytes[0] == (byte) 169 && bytes[1] == (byte) 254;
        if (isIPv6())
            return bytes[0] == (byte) 0xfe && (bytes[1] & 0xc0) == 0x80;
        return false;
    }

    /**
     * 224.0.0/24 for IPv4; ffx2::/16 for IPv6.
     */
    public boolean isLinkLocalMulticast() {
        if (isIPv4())
            return bytes[0] == (byte) 224 && bytes[1] == 0 && bytes[2] == 0;
        if (isIPv6())
            return bytes[0] == (byte) 0xff && (bytes[1] & 0x0f) == 0x02;
        return false;
    }

    /**
     * ffx1::/16, IPv6 only.
     */
    public boolean isInterfaceLocalMulticast() {
        return isIPv6()
               && bytes[0] == (byte) 0xff && (bytes[1] & 0x0f) == 0x01;
    }

    /**
     * An address is global unicast when it falls in none of the special
     * categories of its family. For IPv4 these are private, unspecified,
     * loopback and multicast; for IPv6 unspecified, loopback, multicast and
     * link-local unicast. No allocation table is consulted.
     */
    public boolean isGlobalUnicast() {
        if (isIPv4())
            return !isPrivate() && !isUnspecified() && !isLoopback()
                   && !isMulticast();
        if (isIPv6())
            return !isUnspecified() && !isLoopback() && !isMulticast()
                   && !isLinkLocalUnicast();
        return false;
    }

    /**
     * Unsigned big-endian comparison of the address bytes, where an address
     * sorts before any longer one it is a prefix of. Zones are ignored.
     */
    @Override
    public int compareTo(Address other) {
        return Integer.signum(BYTE_ORDER.compare(bytes, other.bytes));
    }

    public boolean lessThan(Address other) {
        return compareTo(other) < 0;
    }

    /**
     * The raw 4 or 16 address bytes. The zone is not encoded.
     *
     * @throws IllegalStateException for the invalid address.
     */
    public byte[] marshalBinary() {
        if (!isValid())
            throw new IllegalStateException(
                "Invalid address cannot be marshaled.");
        return bytes.clone();
    }

    /**
     * UTF-8 bytes of {@link #toString()}, or no bytes at all for the
     * invalid address.
     */
    public byte[] marshalText() {
        if (!isValid())
            return new byte[0];
        return toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns a new array holding {@code buffer} followed by the raw
     * address bytes.
     */
    public byte[] appendTo(byte[] buffer) {
        byte[] result = Arrays.copyOf(buffer, buffer.length + bytes.length);
        System.arraycopy(bytes, 0, result, buffer.length, bytes.length);
        return result;
    }

    UInt128 toUInt128() {
        return UInt128.fromBytes(bytes);
    }

    static Address fromUInt128(UInt128 value, int length, String zone) {
        return new Address(value.toBytes(length), zone);
    }

    /**
     * Dotted decimal for IPv4. For IPv6, lower case hex groups where the
     * first run of zero groups is written as "::" and IPv4-mapped addresses
     * are written as ::ffff:a.b.c.d, followed by "%zone" if there is one.
     */
    @JsonValue
    @Override
    public String toString() {
        if (string == null)
            string = format();
        return string;
    }

    private String format() {
        if (isIPv4())
            return dottedQuad(0);
        if (!isIPv6())
            return INVALID_STRING;

        StringBuilder sb = new StringBuilder();
        if (isIPv4MappedIPv6()) {
            sb.append("::ffff:").append(dottedQuad(12));
        } else {
            String[] groups = new String[8];
            int zeroStart = -1;
            for (int i = 0; i < 8; i++) {
                int group = Unsigned.unsignedShortAt(bytes, 2 * i);
                groups[i] = Integer.toHexString(group);
                if (group == 0 && zeroStart < 0)
                    zeroStart = i;
            }
            if (zeroStart < 0) {
                sb.append(StringUtils.join(groups, ':'));
            } else {
                // Only the first zero run is compressed, not the longest.
                int zeroEnd = zeroStart;
                while (zeroEnd < 8 && "0".equals(groups[zeroEnd]))
                    zeroEnd++;
                sb.append(StringUtils.join(groups, ':', 0, zeroStart))
                  .append("::")
                  .append(StringUtils.join(groups, ':', zeroEnd, 8));
            }
        }
        if (zone != null)
            sb.append('%').append(zone);
        return sb.toString();
    }

    /**
     * All eight IPv6 groups padded to four hex digits, without any
     * compression. IPv4 addresses are written in dotted decimal.
     */
    public String toExpandedString() {
        if (isIPv4())
            return dottedQuad(0);
        if (!isIPv6())
            return INVALID_STRING;

        StringBuilder sb = new StringBuilder(39);
        for (int i = 0; i < 8; i++) {
            if (i > 0)
                sb.append(':');
            sb.append(String.format("%04x",
                                    Unsigned.unsignedShortAt(bytes, 2 * i)));
        }
        if (zone != null)
            sb.append('%').append(zone);
        return sb.toString();
    }

    private String dottedQuad(int offset) {
        return Unsigned.unsign(bytes[offset]) + "." +
               Unsigned.unsign(bytes[offset + 1]) + "." +
               Unsigned.unsign(bytes[offset + 2]) + "." +
               Unsigned.unsign(bytes[offset + 3]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address that = (Address) o;
        return Arrays.equals(bytes, that.bytes)
               && Objects.equals(zone, that.zone);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes)
               + (zone == null ? 0 : zone.hashCode());
    }
}
