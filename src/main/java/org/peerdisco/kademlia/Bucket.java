package org.peerdisco.kademlia;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Contacts that share one distance class from the local node, ordered from least recently seen (head) to most recently seen (tail).
 * <p>
 * The bucket never evicts by itself. Once it holds more than {@code bucketSize} contacts, every touch or remove reports the head as an
 * eviction candidate and it's up to the caller to check that contact and remove it if it's gone.
 */
final class Bucket {
    private final int bucketSize;
    private final LinkedList<Contact> entries;

    Bucket(int bucketSize) {
        Validate.isTrue(bucketSize > 0);

        this.bucketSize = bucketSize;
        this.entries = new LinkedList<>();
    }

    /**
     * Marks {@code contact} as most recently seen. An exact match already in the bucket is moved to the tail. If another entry holds the
     * same ID under a different address, {@code contact} is dropped and the existing entry is kept where it is.
     * @param contact contact that was seen
     * @return least recently seen contact if the bucket is now over capacity
     */
    Optional<Contact> touch(Contact contact) {
        Validate.notNull(contact);

        entries.remove(contact);
        if (!conflicts(contact)) {
            entries.addLast(contact);
        }
        return evictionCandidate();
    }

    Optional<Contact> remove(Contact contact) {
        Validate.notNull(contact);

        entries.remove(contact);
        return evictionCandidate();
    }

    private Optional<Contact> evictionCandidate() {
        if (entries.size() > bucketSize) {
            return Optional.of(entries.getFirst());
        }
        return Optional.empty();
    }

    boolean contains(Contact contact) {
        return entries.contains(contact);
    }

    boolean conflicts(Contact contact) {
        Validate.notNull(contact);

        for (Contact entry : entries) {
            if (entry.conflictsWith(contact)) {
                return true;
            }
        }
        return false;
    }

    void removeByAddress(InetSocketAddress address) {
        Validate.notNull(address);

        Iterator<Contact> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next().getAddress().equals(address)) {
                it.remove();
            }
        }
    }

    // first max entries, in recency order
    List<Contact> snapshot(int max) {
        Validate.isTrue(max >= 0);

        List<Contact> res = new ArrayList<>(Math.min(max, entries.size()));
        Iterator<Contact> it = entries.iterator();
        while (it.hasNext() && res.size() < max) {
            res.add(it.next());
        }
        return res;
    }

    List<Contact> snapshot() {
        return new ArrayList<>(entries);
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Bucket{" + "bucketSize=" + bucketSize + ", entries=" + entries + '}';
    }
}
