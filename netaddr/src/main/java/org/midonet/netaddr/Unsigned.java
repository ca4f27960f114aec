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

final class Unsigned {

    private Unsigned() {}

    public static int unsign(byte b) {
        return b & 0xff;
    }

    /**
     * Reads an unsigned 16 bit value stored big-endian at the given offset.
     */
    public static int unsignedShortAt(byte[] bytes, int offset) {
        return (unsign(bytes[offset]) << 8) | unsign(bytes[offset + 1]);
    }
}
