package org.peerdisco.kademlia;

import java.io.Serializable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Objects;
import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

/**
 * A known peer: a node ID bound to the network address it was seen at.
 * <p>
 * Two contacts are equal only if both ID and address match. Contacts with the same ID but different addresses are conflicting variants
 * of the same peer (see {@link #conflictsWith(Contact) }), and a routing table never holds both.
 * <p>
 * Contacts are totally ordered by ID, then by address. The order has no network meaning, it only makes ranked results reproducible.
 * <p>
 * Class is immutable.
 */
public final class Contact implements Comparable<Contact>, Serializable {
    private static final long serialVersionUID = 1L;

    private final NodeId id;
    private final InetSocketAddress address;

    /**
     * Constructs a {@link Contact} object.
     * @param id ID of node
     * @param address address the node is reachable at
     * @throws NullPointerException if any argument is {@code null}
     */
    public Contact(NodeId id, InetSocketAddress address) {
        Validate.notNull(id);
        Validate.notNull(address);
        this.id = id;
        this.address = address;
    }

    /**
     * Get this contact's ID.
     * @return ID
     */
    public NodeId getId() {
        return id;
    }

    /**
     * Get this contact's address.
     * @return address
     */
    public InetSocketAddress getAddress() {
        return address;
    }

    /**
     * Equivalent to {@code getId().log2Distance(other)}.
     * @param other ID to measure against
     * @return distance class
     */
    public int log2Distance(NodeId other) {
        return id.log2Distance(other);
    }

    /**
     * Checks if this contact and {@code other} claim the same ID from different addresses.
     * @param other contact to check against
     * @return {@code true} if the IDs are equal but the addresses aren't
     * @throws NullPointerException if any argument is {@code null}
     */
    public boolean conflictsWith(Contact other) {
        Validate.notNull(other);
        return id.equals(other.id) && !address.equals(other.address);
    }

    @Override
    public int compareTo(@NotNull Contact other) {
        int res = id.compareTo(other.id);
        if (res != 0) {
            return res;
        }
        return compareAddresses(address, other.address);
    }

    // resolved before unresolved, ipv4 before ipv6, then unsigned address bytes, then port
    private static int compareAddresses(InetSocketAddress a, InetSocketAddress b) {
        InetAddress ipA = a.getAddress();
        InetAddress ipB = b.getAddress();
        int res;
        if (ipA != null && ipB != null) {
            byte[] bytesA = ipA.getAddress();
            byte[] bytesB = ipB.getAddress();
            res = Integer.compare(bytesA.length, bytesB.length);
            if (res == 0) {
                res = Arrays.compareUnsigned(bytesA, bytesB);
            }
        } else if (ipA == null && ipB == null) {
            res = a.getHostString().compareToIgnoreCase(b.getHostString());
        } else {
            res = ipA == null ? 1 : -1;
        }
        if (res != 0) {
            return res;
        }
        return Integer.compare(a.getPort(), b.getPort());
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + Objects.hashCode(this.id);
        hash = 37 * hash + Objects.hashCode(this.address);
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
        final Contact other = (Contact) obj;
        if (!Objects.equals(this.id, other.id)) {
            return false;
        }
        if (!Objects.equals(this.address, other.address)) {
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Contact{" + "id=" + id.toHex() + ", address=" + address + '}';
    }

}
