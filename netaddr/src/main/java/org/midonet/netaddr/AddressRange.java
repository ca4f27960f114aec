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

import com.google.common.base.Preconditions;

/**
 * The inclusive span of addresses covered by a prefix, from its network
 * address to its last address.
 */
public final class AddressRange {

    private final Address from;
    private final Address to;

    public AddressRange(Address from, Address to) {
        Preconditions.checkNotNull(from);
        Preconditions.checkNotNull(to);
        if (from.compareTo(to) > 0)
            throw new IllegalArgumentException("Range start > range end!");
        this.from = from;
        this.to = to;
    }

    public Address from() {
        return from;
    }

    public Address to() {
        return to;
    }

    /**
     * Tells whether the given address lies between both bounds, inclusive.
     * Addresses of the other family are never inside.
     */
    public boolean isInside(Address address) {
        if (address.bitLength() != from.bitLength())
            return false;
        return from.compareTo(address) <= 0 && to.compareTo(address) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AddressRange)) return false;

        AddressRange range = (AddressRange) o;
        return from.equals(range.from) && to.equals(range.to);
    }

    @Override
    public int hashCode() {
        return 31 * from.hashCode() + to.hashCode();
    }

    @Override
    public String toString() {
        return "Range [" + from + ", " + to + "]";
    }
}
