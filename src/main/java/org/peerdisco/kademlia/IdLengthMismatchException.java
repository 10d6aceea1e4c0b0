/*
 * Copyright (c) 2017, Kasra Faghihi, All rights reserved.
 * 
 * This library is free software; you can redistribute it and/or
 * modify it under the terms of the GNU Lesser General Public
 * License as published by the Free Software Foundation; either
 * version 3.0 of the License, or (at your option) any later version.
 * 
 * This library is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
 * Lesser General Public License for more details.
 * 
 * You should have received a copy of the GNU Lesser General Public
 * License along with this library.
 */
package org.peerdisco.kademlia;

import org.apache.commons.lang3.Validate;

/**
 * Thrown to indicate that two node IDs of different bit lengths were combined (XORed or measured against each other).
 * <p>
 * Class is immutable.
 */
public final class IdLengthMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final NodeId id;
    private final int expectedLength;

    IdLengthMismatchException(NodeId id, int expectedBitLength) {
        super("ID bitlength mismatch (required " + expectedBitLength + "): " + id);
        Validate.notNull(id);
        Validate.isTrue(expectedBitLength > 0);
        Validate.isTrue(expectedBitLength != id.getBitLength());
        this.id = id;
        this.expectedLength = expectedBitLength;
    }

    /**
     * Get the offending ID.
     * @return ID whose length didn't match
     */
    public NodeId getId() {
        return id;
    }

    /**
     * Get the bit length the offending ID should have had.
     * @return expected bit length
     */
    public int getExpectedLength() {
        return expectedLength;
    }

}
