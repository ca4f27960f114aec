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
 * Fixed width unsigned 128 bit integer held as two 64 bit words, wide
 * enough for any address. Values wrap modulo 2^128.
 */
final class UInt128 {

    public static final UInt128 ZERO = new UInt128(0L, 0L);

    private final long upper;
    private final long lower;

    UInt128(long upper, long lower) {
        this.upper = upper;
        this.lower = lower;
    }

    public long upperWord() {
        return upper;
    }

    public long lowerWord() {
        return lower;
    }

    /**
     * Reads up to 16 big-endian bytes; shorter inputs fill the low order
     * bytes.
     */
    public static UInt128 fromBytes(byte[] bytes) {
        Preconditions.checkArgument(bytes.length <= 16,
                                    "At most 16 bytes fit in 128 bits");
        long upper = 0L;
        long lower = 0L;
        for (byte b : bytes) {
            upper = (upper << 8) | (lower >>> 56);
            lower = (lower << 8) | Unsigned.unsign(b);
        }
        return new UInt128(upper, lower);
    }

    /**
     * Returns 2^bits - 1, the value with the low {@code bits} bits set.
     */
    public static UInt128 lowBits(int bits) {
        Preconditions.checkArgument(bits >= 0 && bits <= 128,
                                    "Bit count out of range: %s", bits);
        if (bits == 0)
            return ZERO;
        if (bits <= 64)
            return new UInt128(0L, ~0L >>> (64 - bits));
        return new UInt128(~0L >>> (128 - bits), ~0L);
    }

    public UInt128 add(UInt128 other) {
        long sum = lower + other.lower;
        long carry = Long.compareUnsigned(sum, lower) < 0 ? 1L : 0L;
        return new UInt128(upper + other.upper + carry, sum);
    }

    /**
     * Writes the low order {@code length} bytes big-endian, dropping any
     * higher bytes.
     */
    public byte[] toBytes(int length) {
        Preconditions.checkArgument(length >= 0 && length <= 16,
                                    "Byte length out of range: %s", length);
        byte[] bytes = new byte[length];
        long hi = upper;
        long lo = lower;
        for (int i = length - 1; i >= 0; i--) {
            bytes[i] = (byte) lo;
            lo = (lo >>> 8) | (hi << 56);
            hi >>>= 8;
        }
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UInt128)) return false;
        UInt128 that = (UInt128) o;
        return upper == that.upper && lower == that.lower;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(upper) + Long.hashCode(lower);
    }

    @Override
    public String toString() {
        return String.format("%016x%016x", upper, lower);
    }
}
