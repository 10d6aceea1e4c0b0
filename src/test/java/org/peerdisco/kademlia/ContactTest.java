package org.peerdisco.kademlia;

import org.junit.*;

import java.net.*;
import java.util.*;

public class ContactTest {

    private static InetSocketAddress address(int a, int b, int c, int d, int port) throws UnknownHostException {
        return new InetSocketAddress(InetAddress.getByAddress(new byte[]{(byte) a, (byte) b, (byte) c, (byte) d}), port);
    }

    @Test
    public void equalityNeedsIdAndAddress() throws Exception {
        NodeId id = NodeId.createFromLong(7, 32);
        Contact contact = new Contact(id, address(10, 0, 0, 1, 4000));
        Assert.assertEquals(contact, new Contact(id, address(10, 0, 0, 1, 4000)));
        Assert.assertNotEquals(contact, new Contact(id, address(10, 0, 0, 1, 4001)));
        Assert.assertNotEquals(contact, new Contact(NodeId.createFromLong(8, 32), address(10, 0, 0, 1, 4000)));
    }

    @Test
    public void sameIdOtherAddressConflicts() throws Exception {
        NodeId id = NodeId.createFromLong(7, 32);
        Contact contact = new Contact(id, address(10, 0, 0, 1, 4000));
        Assert.assertTrue(contact.conflictsWith(new Contact(id, address(10, 0, 0, 2, 4000))));
        Assert.assertFalse(contact.conflictsWith(contact));
        Assert.assertFalse(contact.conflictsWith(new Contact(NodeId.createFromLong(8, 32), address(10, 0, 0, 2, 4000))));
    }

    @Test
    public void orderedByIdThenAddress() throws Exception {
        NodeId one = NodeId.createFromLong(1, 32);
        NodeId two = NodeId.createFromLong(2, 32);
        Contact a = new Contact(one, address(192, 168, 0, 1, 9000));
        Contact b = new Contact(one, address(192, 168, 0, 1, 9001));
        Contact c = new Contact(one, address(200, 0, 0, 1, 1));
        Contact d = new Contact(one, new InetSocketAddress(InetAddress.getByName("::1"), 1));
        Contact e = new Contact(two, address(1, 1, 1, 1, 1));

        List<Contact> sorted = new ArrayList<>(Arrays.asList(e, d, c, b, a));
        Collections.sort(sorted);
        Assert.assertEquals(Arrays.asList(a, b, c, d, e), sorted);
    }

    @Test
    public void unresolvedAddressesSortLast() throws Exception {
        NodeId id = NodeId.createFromLong(1, 32);
        Contact resolved = new Contact(id, address(127, 0, 0, 1, 1));
        Contact unresolved = new Contact(id, InetSocketAddress.createUnresolved("peer.example", 1));
        Assert.assertTrue(resolved.compareTo(unresolved) < 0);
        Assert.assertTrue(unresolved.compareTo(resolved) > 0);
    }

    @Test
    public void unresolvedHostOrderIgnoresCase() {
        NodeId id = NodeId.createFromLong(1, 32);
        Contact upper = new Contact(id, InetSocketAddress.createUnresolved("Host", 1));
        Contact lower = new Contact(id, InetSocketAddress.createUnresolved("host", 1));
        Assert.assertEquals(upper, lower);
        Assert.assertEquals(0, upper.compareTo(lower));
        Assert.assertEquals(0, lower.compareTo(upper));
    }

    @Test
    public void distanceRanksByDistanceFirst() throws Exception {
        NodeId target = NodeId.createFromLong(0, 32);
        ContactDistance near = ContactDistance.of(new Contact(NodeId.createFromLong(3, 32), address(1, 1, 1, 1, 1)), target);
        ContactDistance nearTie = ContactDistance.of(new Contact(NodeId.createFromLong(2, 32), address(1, 1, 1, 1, 1)), target);
        ContactDistance far = ContactDistance.of(new Contact(NodeId.createFromLong(4, 32), address(1, 1, 1, 1, 1)), target);

        Assert.assertEquals(2, near.distance());
        Assert.assertTrue(near.compareTo(far) < 0);
        Assert.assertTrue(nearTie.compareTo(near) < 0);
    }
}
