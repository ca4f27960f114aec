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
import com.google.common.collect.ComparisonChain;

import org.apache.commons.lang.StringUtils;

import org.midonet.netaddr.AddressException.Kind;

/**
 * An IP address and a port number, written "1.2.3.4:80" or "[2001:db8::1]:80".
 *
 * The constructor stores the port as given; only {@link #parse(String)}
 * checks that it lies in [0, 65535]. The pair is valid whenever its address
 * is.
 */
public final class AddressPort implements Comparable<AddressPort> {

    public static final int MAX_PORT = 0xffff;

    private final Address address;
    private final int port;

    public AddressPort(Address address, int port) {
        this.address = Preconditions.checkNotNull(address);
        this.port = port;
    }

    public static AddressPort from(Address address, int port) {
        return new AddressPort(address, port);
    }

    /**
     * Parses "ip:port" or "[ipv6]:port". IPv6 literals must be bracketed;
     * no name resolution takes place.
     *
     * @throws AddressException if the text is not a valid address and port.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AddressPort parse(String input) {
        if (input == null || input.indexOf(':') < 0)
            throw new AddressException(Kind.FORMAT,
                                       "Invalid AddrPort format: " + input);

        String ipPart;
        String portPart;
        if (input.startsWith("[")) {
            // A zone may itself contain ']', the address ends at the last one.
            int close = input.lastIndexOf(']');
            if (close < 0 || close + 1 >= input.length()
                    || input.charAt(close + 1) != ':')
                throw new AddressException(Kind.FORMAT,
                    "Invalid AddrPort format: " + input);
            ipPart = input.substring(1, close);
            portPart = input.substring(close + 2);
        } else {
            if (StringUtils.countMatches(input, ":") > 1)
                throw new AddressException(Kind.FORMAT,
                    "Invalid AddrPort format, IPv6 addresses must be " +
                    "bracketed: " + input);
            int colon = input.lastIndexOf(':');
            ipPart = input.substring(0, colon);
            portPart = input.substring(colon + 1);
        }

        Address address = Address.parse(ipPart);

        if (portPart.isEmpty() || !AddressParser.DIGITS.matchesAllOf(portPart))
            throw new AddressException(Kind.LEXICAL,
                                       "Invalid port number: " + portPart);
        int port = AddressParser.decimal(portPart);
        if (port > MAX_PORT)
            throw new AddressException(Kind.RANGE,
                                       "Invalid port number: " + portPart);

        return new AddressPort(address, port);
    }

    /**
     * Like {@link #parse(String)}, for call sites where a failure is a
     * programming error.
     */
    public static AddressPort mustParse(String input) {
        try {
            return parse(input);
        } catch (AddressException e) {
            throw new IllegalArgumentException(
                "Failed to parse address port: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes the form written by {@link #marshalBinary()}: the address
     * bytes followed by the port, little-endian, in two bytes.
     */
    public static AddressPort unmarshalBinary(byte[] data) {
        Preconditions.checkNotNull(data);
        if (data.length < 2)
            throw new AddressException(Kind.CODEC,
                "Invalid binary data for AddrPort, length " + data.length);
        int n = data.length;
        int port = (Unsigned.unsign(data[n - 1]) << 8)
                   | Unsigned.unsign(data[n - 2]);
        Address address = Address.unmarshalBinary(Arrays.copyOf(data, n - 2));
        return new AddressPort(address, port);
    }

    public static AddressPort unmarshalText(String text) {
        return parse(text);
    }

    public Address getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public boolean isValid() {
        return address.isValid();
    }

    /**
     * Orders by address, then by port.
     */
    @Override
    public int compareTo(AddressPort other) {
        return ComparisonChain.start()
            .compare(address, other.address)
            .compare(port, other.port)
            .result();
    }

    /**
     * The address bytes followed by the low 16 bits of the port,
     * little-endian.
     *
     * @throws IllegalStateException if the address is invalid.
     */
    public byte[] marshalBinary() {
        if (!isValid())
            throw new IllegalStateException(
                "Invalid AddrPort cannot be marshaled.");
        byte[] ip = address.marshalBinary();
        byte[] data = Arrays.copyOf(ip, ip.length + 2);
        data[ip.length] = (byte) port;
        data[ip.length + 1] = (byte) (port >> 8);
        return data;
    }

    /**
     * UTF-8 bytes of {@link #toString()}; empty if the address is invalid.
     */
    public byte[] marshalText() {
        return toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns a new array holding {@code buffer} followed by the text form
     * of this pair.
     */
    public byte[] appendTo(byte[] buffer) {
        byte[] text = marshalText();
        byte[] result = Arrays.copyOf(buffer, buffer.length + text.length);
        System.arraycopy(text, 0, result, buffer.length, text.length);
        return result;
    }

    /**
     * The address is bracketed when it is IPv6, except for IPv4-mapped
     * addresses which are written bare.
     */
    @JsonValue
    @Override
    public String toString() {
        if (!isValid())
            return "";
        if (address.isIPv6() && !address.isIPv4MappedIPv6())
            return "[" + address + "]:" + port;
        return address + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AddressPort)) return false;
        AddressPort that = (AddressPort) o;
        return port == that.port && Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, port);
    }
}
