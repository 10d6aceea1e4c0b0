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

import java.io.Serializable;
import java.util.Arrays;
import java.util.Random;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;
import org.peerdisco.util.ArrayOps;

/**
 * Kademlia node ID. Width is a whole number of bytes, fixed per network. Bytes are held big-endian, so byte 0 carries the most significant
 * bits.
 * <p>
 * Distance between two IDs is expressed as a distance class (see {@link #log2Distance(NodeId) }) rather than the raw XOR value, which is
 * what the routing table buckets on.
 * <p>
 * Class is immutable.
 */
public final class NodeId implements Comparable<NodeId>, Serializable {
    private static final long serialVersionUID = 1L;

    private final byte[] data;

    // make sure that whatever you pass in as data is a copy / not-shared.
    private NodeId(byte[] data) {
        Validate.notNull(data);
        Validate.isTrue(data.length > 0);

        this.data = data;
    }

    /**
     * Constructs a {@link NodeId} from a big-endian byte array. The array is copied.
     * @param data id value
     * @return created id
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code data} is empty
     */
    public static NodeId create(byte[] data) {
        Validate.notNull(data);
        Validate.isTrue(data.length > 0, "Node ID must have at least one byte");

        return new NodeId(data.clone());
    }

    /**
     * Constructs a {@link NodeId} from a hex string. Two characters per byte, upper or lower case, no prefix.
     * @param hex id value
     * @return created id
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code hex} is empty, has an odd number of characters or contains a non-hex character
     */
    public static NodeId fromHex(String hex) {
        Validate.notNull(hex);
        Validate.isTrue(!hex.isEmpty() && hex.length() % 2 == 0, "Invalid node ID hex: %s", hex);

        try {
            return new NodeId(ArrayOps.hexToBytes(hex));
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("Invalid node ID hex: " + hex, nfe);
        }
    }

    /**
     * Constructs a {@link NodeId} from a long. The long is placed at the low end of the id, so {@code createFromLong(5, 32)} is a 256-bit
     * id whose last byte is {@code 0x05} and whose other bytes are zero. If {@code byteLength < 8} the high bytes of the long are dropped.
     * @param value id value
     * @param byteLength number of bytes in this id
     * @return created id
     * @throws IllegalArgumentException if {@code byteLength <= 0}
     */
    public static NodeId createFromLong(long value, int byteLength) {
        Validate.isTrue(byteLength > 0);

        byte[] bytes = new byte[byteLength];
        for (int i = 0; i < Math.min(8, byteLength); i++) {
            bytes[byteLength - 1 - i] = (byte) (value >>> (i * 8));
        }
        return new NodeId(bytes);
    }

    /**
     * Generates a random {@link NodeId}.
     * @param random source of randomness
     * @param byteLength number of bytes in this id
     * @return created id
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code byteLength <= 0}
     */
    public static NodeId random(Random random, int byteLength) {
        Validate.notNull(random);
        Validate.isTrue(byteLength > 0);

        byte[] bytes = new byte[byteLength];
        random.nextBytes(bytes);
        return new NodeId(bytes);
    }

    /**
     * XORs this id with another.
     * @param other other ID
     * @return new id holding {@code this ^ other}
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if the bitlength of {@code other} doesn't match the bitlength of {@code this}
     */
    public NodeId xor(NodeId other) {
        Validate.notNull(other);
        checkLength(other);

        byte[] res = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            res[i] = (byte) (data[i] ^ other.data[i]);
        }
        return new NodeId(res);
    }

    /**
     * Gets the distance class between this id and another: the 1-based position of the highest set bit in {@code this ^ other}, counting
     * from the least significant bit. Identical ids are at distance {@code 0}, ids differing only in the lowest bit are at distance
     * {@code 1}, and ids differing in the top bit are at distance {@link #getBitLength() }.
     * @param other other ID
     * @return distance class in {@code [0, getBitLength()]}
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if the bitlength of {@code other} doesn't match the bitlength of {@code this}
     */
    public int log2Distance(NodeId other) {
        Validate.notNull(other);
        checkLength(other);

        for (int i = 0; i < data.length; i++) {
            int xor = (data[i] ^ other.data[i]) & 0xFF;
            if (xor != 0) {
                int bitsBelow = (data.length - 1 - i) * 8;
                return bitsBelow + (32 - Integer.numberOfLeadingZeros(xor));
            }
        }
        return 0;
    }

    private void checkLength(NodeId other) {
        if (other.data.length != data.length) {
            throw new IdLengthMismatchException(other, getBitLength());
        }
    }

    /**
     * Gets the bit length of this ID.
     * @return bit length of this ID
     */
    public int getBitLength() {
        return data.length * 8;
    }

    /**
     * Gets a copy of the data for this ID.
     * @return ID as big-endian bytes
     */
    public byte[] getBytes() {
        return data.clone();
    }

    public String toHex() {
        return ArrayOps.bytesToHex(data);
    }

    // unsigned lexicographic, shorter ids first
    @Override
    public int compareTo(@NotNull NodeId other) {
        int res = Integer.compare(data.length, other.data.length);
        if (res != 0) {
            return res;
        }
        return Arrays.compareUnsigned(data, other.data);
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 31 * hash + Arrays.hashCode(this.data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final NodeId other = (NodeId) obj;
        return Arrays.equals(this.data, other.data);
    }

    @Override
    public String toString() {
        return "NodeId{" + toHex() + '}';
    }
}
