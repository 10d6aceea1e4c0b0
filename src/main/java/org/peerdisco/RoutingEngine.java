package org.peerdisco;

import io.prometheus.client.*;
import org.peerdisco.kademlia.*;

import java.net.*;
import java.util.*;
import java.util.logging.*;

/**
 * Owns the routing table of one node and serialises access to it. The discovery loop reports peers through
 * {@link #onContactSeen(Contact)} and acts on the eviction candidates it gets back.
 */
public class RoutingEngine {
    private static final Logger LOG = Logger.getLogger(RoutingEngine.class.getName());

    private static final Counter touches = Counter.build()
            .name("routing_table_touches")
            .help("Total contacts reported as seen to the routing table")
            .register();
    private static final Counter rejectedConflicts = Counter.build()
            .name("routing_table_rejected_conflicts")
            .help("Total touches rejected because the node ID is bound to another address, or is our own ID")
            .register();
    private static final Counter evictionCandidates = Counter.build()
            .name("routing_table_eviction_candidates")
            .help("Total eviction candidates handed back to the caller")
            .register();
    private static final Counter removals = Counter.build()
            .name("routing_table_removals")
            .help("Total contacts removed from the routing table")
            .register();
    private static final Gauge contacts = Gauge.build()
            .name("routing_table_contacts")
            .help("Number of contacts in the routing table")
            .register();

    private final RoutingTable table;

    public RoutingEngine(NodeId localId, int bucketSize) {
        this.table = new RoutingTable(localId, bucketSize);
    }

    public NodeId getLocalId() {
        return table.getLocalId();
    }

    /**
     * Call whenever {@code contact} answers us.
     *
     * @return a contact the caller should ping, and {@link #removeContact(Contact)} if it doesn't answer
     */
    public synchronized Optional<Contact> onContactSeen(Contact contact) {
        boolean conflicting = table.conflicts(contact);
        touches.inc();
        if (conflicting)
            rejectedConflicts.inc();
        Optional<Contact> candidate = table.touch(contact);
        if (candidate.isPresent()) {
            evictionCandidates.inc();
            LOG.fine("Bucket full, eviction candidate " + candidate.get());
        }
        contacts.set(table.size());
        return candidate;
    }

    public synchronized Optional<Contact> removeContact(Contact contact) {
        int before = table.size();
        Optional<Contact> candidate = table.remove(contact);
        removals.inc(before - table.size());
        contacts.set(table.size());
        return candidate;
    }

    /**
     * Call when the connection to {@code address} is gone, whichever node ID it was registered under.
     */
    public synchronized void removeAddress(InetSocketAddress address) {
        int before = table.size();
        table.removeByAddress(address);
        int removed = before - table.size();
        if (removed > 0) {
            removals.inc(removed);
            LOG.info("Removed " + removed + " contacts at " + address);
        }
        contacts.set(table.size());
    }

    public synchronized boolean isKnown(Contact contact) {
        return table.contains(contact);
    }

    public synchronized boolean wouldConflict(Contact contact) {
        return table.conflicts(contact);
    }

    public synchronized List<Contact> getKClosestContacts(NodeId target, int k) {
        return table.closestContacts(target, k);
    }

    public synchronized void cleanup() {
        int before = table.distances().size();
        table.cleanup();
        int dropped = before - table.distances().size();
        if (dropped > 0)
            LOG.info("Dropped " + dropped + " empty buckets");
    }

    public synchronized List<Integer> distances() {
        return table.distances();
    }

    public synchronized List<Contact> contactsAt(int distance) {
        return table.contactsAt(distance);
    }

    public synchronized List<Contact> allContacts() {
        return table.allContacts();
    }

    public synchronized int size() {
        return table.size();
    }
}
