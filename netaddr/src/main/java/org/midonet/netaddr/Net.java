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

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.UnknownHostException;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between the address types of this package and java.net.
 * Nothing here performs name resolution or touches the network.
 */
public final class Net {

    private static final Logger log = LoggerFactory.getLogger(Net.class);

    private Net() {}

    /**
     * Converts an address to an {@link InetAddress}. A numeric zone becomes
     * the scope id of the resulting {@link Inet6Address}; other zones have
     * no portable equivalent without looking up the interface and are
     * dropped.
     *
     * Note that java.net turns IPv4-mapped IPv6 bytes into an
     * {@link java.net.Inet4Address}.
     *
     * @throws IllegalArgumentException if the address is invalid.
     */
    public static InetAddress toInetAddress(Address address) {
        Preconditions.checkArgument(address.isValid(),
                                    "Invalid address: %s", address);
        byte[] bytes = address.toBytes();
        try {
            if (address.hasZone()) {
                String zone = address.getZone();
                if (AddressParser.DIGITS.matchesAllOf(zone)
                        && zone.length() < 10) {
                    return Inet6Address.getByAddress(
                        null, bytes, Integer.parseInt(zone));
                }
                log.debug("Dropping non-numeric zone {} of {}", zone, address);
            }
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Only thrown for byte arrays of illegal length.
            throw new IllegalStateException(
                "Cannot convert " + address + " to InetAddress", e);
        }
    }

    /**
     * Converts an {@link InetAddress} to an address. The scope of an
     * {@link Inet6Address} becomes its zone: the interface name when the
     * scope is bound to one, the numeric scope id otherwise.
     */
    public static Address fromInetAddress(InetAddress inet) {
        Preconditions.checkNotNull(inet);
        Address address = Address.fromBytes(inet.getAddress());
        if (inet instanceof Inet6Address) {
            Inet6Address inet6 = (Inet6Address) inet;
            NetworkInterface nic = inet6.getScopedInterface();
            if (nic != null)
                return address.withZone(nic.getName());
            if (inet6.getScopeId() != 0)
                return address.withZone(Integer.toString(inet6.getScopeId()));
        }
        return address;
    }

    /**
     * @throws IllegalArgumentException if the address is invalid or the
     *         port is not in [0, 65535].
     */
    public static InetSocketAddress toInetSocketAddress(AddressPort addrPort) {
        Preconditions.checkArgument(
            addrPort.getPort() >= 0 && addrPort.getPort() <= AddressPort.MAX_PORT,
            "Port out of range: %s", addrPort.getPort());
        return new InetSocketAddress(toInetAddress(addrPort.getAddress()),
                                     addrPort.getPort());
    }

    /**
     * @throws IllegalArgumentException if the socket address is unresolved.
     */
    public static AddressPort fromInetSocketAddress(InetSocketAddress sa) {
        Preconditions.checkNotNull(sa);
        Preconditions.checkArgument(!sa.isUnresolved(),
                                    "Unresolved socket address: %s", sa);
        return new AddressPort(fromInetAddress(sa.getAddress()), sa.getPort());
    }
}
