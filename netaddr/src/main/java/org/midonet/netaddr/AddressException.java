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

/**
 * Thrown when an address, prefix or address/port pair cannot be decoded
 * from its textual or binary form, or when an argument falls outside the
 * range an operation accepts. The {@link Kind} tells callers which class of
 * problem was found without having to inspect the message.
 */
public class AddressException extends IllegalArgumentException {

    private static final long serialVersionUID = -6218831466217347213L;

    public enum Kind {
        /** The overall shape of the input is not recognized. */
        FORMAT,
        /** An invalid character, or a field with too many digits. */
        LEXICAL,
        /** A numeric field (octet, hextet, port, prefix length) is out of
         *  bounds. */
        RANGE,
        /** The fields are well formed but do not assemble into an address:
         *  repeated "::", misplaced embedded IPv4, too few or too many
         *  fields. */
        STRUCTURE,
        /** A binary buffer has the wrong length. */
        CODEC
    }

    private final Kind kind;

    public AddressException(Kind kind, String msg) {
        super(msg);
        this.kind = kind;
    }

    public AddressException(Kind kind, String msg, Throwable cause) {
        super(msg, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
