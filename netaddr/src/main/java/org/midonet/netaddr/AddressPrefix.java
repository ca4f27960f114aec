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
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.midonet.netaddr.AddressException.Kind;

/**
 * An IP network in CIDR form: an address and the number of leading bits
 * that identify the network.
 *
 * The raw constructor accepts any length and stores -1 when it does not fit
 * the address family, leaving an invalid prefix; {@link #parse(String)}
 * instead refuses such input. Invalid prefixes answer false to every
 * predicate and print as the empty string.
 */
public final class AddressPrefix {

    private static final Logger log =
        LoggerFactory.getLogger(AddressPrefix.class);

    private final Address address;
    private final int bits;
    private String string = null; // not final to allow lazy init

    /**
     * Does not mask off the host bits of the address, see {@link #masked()}.
     */
    public AddressPrefix(Address address, int bits) {
        this.address = Preconditions.checkNotNull(address);
        if (bits < 0 || bits > address.bitLength()) {
            log.debug("Prefix length {} out of range for {}", bits, address);
            this.bits = -1;
        } else {
            this.bits = bits;
        }
    }

    public static AddressPrefix from(Address address, int bits) {
        return new AddressPrefix(address, bits);
    }

    /**
     * Parses "address/bits", e.g. "192.168.1.0/24" or "2001:db8::/32".
     * The prefix length is mandatory and zones are not allowed.
     *
     * @throws AddressException if the text is not a valid prefix.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AddressPrefix parse(String input) {
        if (input == null)
            throw new AddressException(Kind.FORMAT,
                                       "Invalid prefix format: null");
        String[] parts = StringUtils.splitPreserveAllTokens(input, '/');
        if (parts.length != 2 || parts[1].isEmpty())
            throw new AddressException(Kind.FORMAT,
                                       "Invalid prefix format: " + input);

        Address address = Address.parse(parts[0]);
        if (address.hasZone())
            throw new AddressException(Kind.FORMAT,
                "IPv6 zones are not permitted in prefixes: " + input);

        String bitsPart = parts[1];
        if (!AddressParser.DIGITS.matchesAllOf(bitsPart))
            throw new AddressException(Kind.LEXICAL,
                                       "Invalid prefix length: " + bitsPart);
        int bits = AddressParser.decimal(bitsPart);
        if (bits > address.bitLength())
            throw new AddressException(Kind.RANGE,
                                       "Invalid prefix length: " + bitsPart);

        return new AddressPrefix(address, bits);
    }

    /**
     * Like {@link #parse(String)}, for call sites where a failure is a
     * programming error.
     */
    public static AddressPrefix mustParse(String input) {
        try {
            return parse(input);
        } catch (AddressException e) {
            throw new IllegalArgumentException(
                "Failed to parse prefix: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes the form written by {@link #marshalBinary()}: the address
     * bytes followed by one byte holding the prefix length.
     */
    public static AddressPrefix unmarshalBinary(byte[] data) {
        Preconditions.checkNotNull(data);
        if (data.length < 5)
            throw new AddressException(Kind.CODEC,
                "Invalid binary data for prefix, length " + data.length);
        int bits = Unsigned.unsign(data[data.length - 1]);
        Address address =
            Address.unmarshalBinary(Arrays.copyOf(data, data.length - 1));
        if (bits > address.bitLength())
            throw new AddressException(Kind.RANGE,
                                       "Invalid prefix length: " + bits);
        return new AddressPrefix(address, bits);
    }

    public static AddressPrefix unmarshalText(String text) {
        return parse(text);
    }

    public Address getAddress() {
        return address;
    }

    /**
     * The prefix length, or -1 if the prefix is invalid.
     */
    public int getBits() {
        return bits;
    }

    public boolean isValid() {
        return address.isValid() && bits >= 0 && bits <= address.bitLength();
    }

    /**
     * True when the prefix covers exactly one address.
     */
    public boolean isSingleIP() {
        return isValid() && bits == address.bitLength();
    }

    /**
     * Tells whether the address lies in this network. An IPv4 address never
     * matches an IPv6 prefix and vice versa.
     */
    public boolean contains(Address ip) {
        if (!isValid() || !ip.isValid())
            return false;
        if (address.bitLength() != ip.bitLength())
            return false;

        byte[] net = address.toBytes();
        byte[] other = ip.toBytes();
        int full = bits / 8;
        for (int i = 0; i < full; i++) {
            if (net[i] != other[i])
                return false;
        }
        int rem = bits % 8;
        if (rem == 0)
            return true;
        int mask = (0xff << (8 - rem)) & 0xff;
        return (net[full] & mask) == (other[full] & mask);
    }

    /**
     * The same prefix with every bit past the prefix length cleared, or an
     * invalid prefix if this one is invalid.
     */
    public AddressPrefix masked() {
        if (!isValid())
            return new AddressPrefix(Address.invalid(), -1);
        return new AddressPrefix(address.mask(bits), bits);
    }

    /**
     * Tells whether both networks share at least one address.
     */
    public boolean overlaps(AddressPrefix other) {
        if (!isValid() || !other.isValid())
            return false;
        if (address.bitLength() != other.address.bitLength())
            return false;

        int minBits = Math.min(bits, other.bits);
        return Arrays.equals(address.mask(minBits).toBytes(),
                             other.address.mask(minBits).toBytes());
    }

    /**
     * The first and last addresses of the network. The last address keeps
     * the zone of this prefix's address.
     *
     * @throws IllegalStateException if the prefix is invalid.
     */
    public AddressRange getRanges() {
        if (!isValid())
            throw new IllegalStateException(
                "Invalid AddressPrefix. Cannot compute range.");

        int width = address.bitLength();
        Address first = address.mask(bits);
        UInt128 last = first.toUInt128().add(UInt128.lowBits(width - bits));
        return new AddressRange(
            first,
            Address.fromUInt128(last, width / 8, address.getZone()));
    }

    /**
     * The address bytes followed by one byte holding the prefix length.
     *
     * @throws IllegalStateException if the prefix is invalid.
     */
    public byte[] marshalBinary() {
        if (!isValid())
            throw new IllegalStateException(
                "Invalid Prefix cannot be marshaled.");
        byte[] ip = address.marshalBinary();
        byte[] data = Arrays.copyOf(ip, ip.length + 1);
        data[ip.length] = (byte) bits;
        return data;
    }

    /**
     * UTF-8 bytes of {@link #toString()}; empty for an invalid prefix.
     */
    public byte[] marshalText() {
        return toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns a new array holding {@code buffer} followed by the text form
     * of this prefix.
     */
    public byte[] appendTo(byte[] buffer) {
        byte[] text = marshalText();
        byte[] result = Arrays.copyOf(buffer, buffer.length + text.length);
        System.arraycopy(text, 0, result, buffer.length, text.length);
        return result;
    }

    @JsonValue
    @Override
    public String toString() {
        if (!isValid())
            return "";
        if (string == null)
            string = address.toString() + "/" + bits;
        return string;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass())
            return false;

        AddressPrefix that = (AddressPrefix) o;
        return bits == that.bits && Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, bits);
    }
}
