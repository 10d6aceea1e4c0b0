package org.peerdisco.kademlia;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.collections4.list.UnmodifiableList;
import org.apache.commons.lang3.Validate;

/**
 * Kademlia routing table. Known contacts are split into buckets by their distance class from the local node ID (see
 * {@link NodeId#log2Distance(NodeId) }), one bucket per class, created the first time a contact for that class is touched.
 * <p>
 * Distance class {@code 0} is the local ID itself. It never gets a bucket: touching or removing a contact with the local ID does nothing,
 * such a contact is never contained and always conflicts.
 * <p>
 * Buckets may grow past {@code bucketSize}. The table doesn't evict, it hands the least recently seen contact of an overfull bucket back
 * from {@link #touch(Contact) } / {@link #remove(Contact) } so the caller can ping it and {@link #remove(Contact) } it if it doesn't
 * answer.
 * <p>
 * This class is not thread-safe. Wrap it (see {@code RoutingEngine}) if more than one thread needs it.
 */
public final class RoutingTable {
    private static final Logger LOG = Logger.getLogger(RoutingTable.class.getName());

    private final NodeId localId;
    private final int bucketSize;
    private final Bucket[] buckets; // indexed by distance class, index 0 is always null

    /**
     * Constructs an empty {@link RoutingTable} object.
     * @param localId ID of the node that this routing table is for
     * @param bucketSize nominal capacity of each bucket (the k value), also the cap on every closest contacts query
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code bucketSize <= 0}
     */
    public RoutingTable(NodeId localId, int bucketSize) {
        Validate.notNull(localId);
        Validate.isTrue(bucketSize > 0, "Bucket size must be positive: %d", bucketSize);

        this.localId = localId;
        this.bucketSize = bucketSize;
        this.buckets = new Bucket[localId.getBitLength() + 1];
    }

    public NodeId getLocalId() {
        return localId;
    }

    public int getBucketSize() {
        return bucketSize;
    }

    /**
     * Records that {@code contact} was just seen. It's appended to (or moved to the tail of) its bucket, unless its ID is the local ID or
     * its bucket already holds its ID under a different address, in which case nothing changes.
     * @param contact contact that responded
     * @return least recently seen contact of the bucket if that bucket is now over capacity, otherwise empty
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if {@code contact}'s ID has a different bit length than the local ID
     */
    public Optional<Contact> touch(Contact contact) {
        Validate.notNull(contact);

        int distance = contact.log2Distance(localId);
        if (distance == 0) {
            LOG.fine("Ignoring touch of local ID " + contact);
            return Optional.empty();
        }

        Bucket bucket = buckets[distance];
        if (bucket == null) {
            bucket = new Bucket(bucketSize);
            buckets[distance] = bucket;
        }
        if (LOG.isLoggable(Level.FINE) && bucket.conflicts(contact)) {
            LOG.fine("Rejecting " + contact + ", ID already bound to another address");
        }
        return bucket.touch(contact);
    }

    /**
     * Removes {@code contact} (exact ID and address match). Contacts sharing only the ID or only the address are left alone.
     * @param contact contact to remove
     * @return least recently seen contact of the bucket if that bucket is still over capacity, otherwise empty
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if {@code contact}'s ID has a different bit length than the local ID
     */
    public Optional<Contact> remove(Contact contact) {
        Validate.notNull(contact);

        Bucket bucket = bucketFor(contact);
        if (bucket == null) {
            return Optional.empty();
        }
        return bucket.remove(contact);
    }

    /**
     * Checks if {@code contact} (exact ID and address match) is in this table.
     * @param contact contact to look for
     * @return {@code true} if present
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if {@code contact}'s ID has a different bit length than the local ID
     */
    public boolean contains(Contact contact) {
        Validate.notNull(contact);

        Bucket bucket = bucketFor(contact);
        return bucket != null && bucket.contains(contact);
    }

    /**
     * Checks if touching {@code contact} would be rejected: either its ID is the local ID, or its ID is already held under a different
     * address.
     * @param contact contact to check
     * @return {@code true} if {@code contact} conflicts with this table
     * @throws NullPointerException if any argument is {@code null}
     * @throws IdLengthMismatchException if {@code contact}'s ID has a different bit length than the local ID
     */
    public boolean conflicts(Contact contact) {
        Validate.notNull(contact);

        int distance = contact.log2Distance(localId);
        if (distance == 0) {
            return true;
        }
        Bucket bucket = buckets[distance];
        return bucket != null && bucket.conflicts(contact);
    }

    // null for the local id or a distance class with no bucket
    private Bucket bucketFor(Contact contact) {
        int distance = contact.log2Distance(localId);
        if (distance == 0) {
            return null;
        }
        return buckets[distance];
    }

    /**
     * Gets the known contacts closest to {@code target}, ordered by ascending distance class to {@code target} and then by
     * {@link Contact} order. A contact whose ID is {@code target} is never returned, neither is the local ID.
     * <p>
     * Only the first {@code bucketSize} contacts (the least recently seen ones) of each bucket are considered.
     * @param target ID to search around
     * @param limit maximum number of contacts to return, further capped at {@code bucketSize}
     * @return closest contacts, at most {@code min(limit, bucketSize)} of them
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code limit < 0}
     * @throws IdLengthMismatchException if {@code target} has a different bit length than the local ID
     */
    public List<Contact> closestContacts(NodeId target, int limit) {
        Validate.notNull(target);
        Validate.isTrue(limit >= 0, "Limit must not be negative: %d", limit);
        if (target.getBitLength() != localId.getBitLength()) {
            throw new IdLengthMismatchException(target, localId.getBitLength());
        }

        int max = Math.min(limit, bucketSize);
        List<Contact> res = new ArrayList<>(max);
        if (max == 0) {
            return UnmodifiableList.unmodifiableList(res);
        }

        // bounded to bucketSize entries, worst one dropped on overflow
        TreeSet<ContactDistance> closest = new TreeSet<>();
        for (int distance = 1; distance < buckets.length; distance++) {
            Bucket bucket = buckets[distance];
            if (bucket == null) {
                continue;
            }
            for (Contact contact : bucket.snapshot(bucketSize)) {
                if (contact.getId().equals(target)) {
                    continue;
                }
                ContactDistance candidate = ContactDistance.of(contact, target);
                if (closest.size() >= bucketSize && candidate.compareTo(closest.last()) > 0) {
                    continue;
                }
                closest.add(candidate);
                if (closest.size() > bucketSize) {
                    closest.pollLast();
                }
            }
        }

        for (ContactDistance cd : closest) {
            if (res.size() == max) {
                break;
            }
            res.add(cd.contact());
        }
        return UnmodifiableList.unmodifiableList(res);
    }

    /**
     * Drops every empty bucket.
     */
    public void cleanup() {
        for (int distance = 1; distance < buckets.length; distance++) {
            if (buckets[distance] != null && buckets[distance].isEmpty()) {
                buckets[distance] = null;
            }
        }
    }

    /**
     * Gets the distance classes that currently have a bucket, in ascending order. A bucket emptied by removals is still listed until
     * {@link #cleanup() }.
     * @return distance classes with a bucket
     */
    public List<Integer> distances() {
        List<Integer> res = new ArrayList<>();
        for (int distance = 1; distance < buckets.length; distance++) {
            if (buckets[distance] != null) {
                res.add(distance);
            }
        }
        return UnmodifiableList.unmodifiableList(res);
    }

    /**
     * Gets the contacts of one bucket, from least to most recently seen.
     * @param distance distance class of the bucket
     * @return contacts in the bucket, empty if there's no bucket for {@code distance}
     */
    public List<Contact> contactsAt(int distance) {
        if (distance <= 0 || distance >= buckets.length || buckets[distance] == null) {
            return UnmodifiableList.unmodifiableList(new ArrayList<Contact>());
        }
        return UnmodifiableList.unmodifiableList(buckets[distance].snapshot());
    }

    /**
     * Gets every contact in this table, bucket by bucket in ascending distance class, each bucket from least to most recently seen.
     * @return all contacts
     */
    public List<Contact> allContacts() {
        List<Contact> res = new ArrayList<>(size());
        for (int distance = 1; distance < buckets.length; distance++) {
            if (buckets[distance] != null) {
                res.addAll(buckets[distance].snapshot());
            }
        }
        return UnmodifiableList.unmodifiableList(res);
    }

    /**
     * Removes every contact reachable at {@code address}, whatever its ID.
     * @param address address to purge
     * @throws NullPointerException if any argument is {@code null}
     */
    public void removeByAddress(InetSocketAddress address) {
        Validate.notNull(address);

        for (Bucket bucket : buckets) {
            if (bucket != null) {
                bucket.removeByAddress(address);
            }
        }
    }

    /**
     * Gets the number of contacts across all buckets.
     * @return number of contacts
     */
    public int size() {
        int res = 0;
        for (Bucket bucket : buckets) {
            if (bucket != null) {
                res += bucket.size();
            }
        }
        return res;
    }

    @Override
    public String toString() {
        return "RoutingTable{" + "localId=" + localId + ", bucketSize=" + bucketSize + ", size=" + size() + '}';
    }
}
