package org.peerdisco.kademlia;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.NotNull;

/**
 * A contact paired with its distance class to some query target. Ordered by distance, then by {@link Contact} order, so that equal
 * distances rank the same way on every query.
 */
record ContactDistance(int distance, Contact contact) implements Comparable<ContactDistance> {

    ContactDistance {
        Validate.isTrue(distance >= 0);
        Validate.notNull(contact);
    }

    static ContactDistance of(Contact contact, NodeId target) {
        return new ContactDistance(contact.log2Distance(target), contact);
    }

    @Override
    public int compareTo(@NotNull ContactDistance other) {
        int res = Integer.compare(distance, other.distance);
        if (res != 0) {
            return res;
        }
        return contact.compareTo(other.contact);
    }
}
