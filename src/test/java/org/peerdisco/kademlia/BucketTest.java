package org.peerdisco.kademlia;

import org.junit.*;

import java.net.*;
import java.util.*;

public class BucketTest {

    private static Contact contact(int id, int port) {
        return new Contact(NodeId.createFromLong(id, 32), new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
    }

    @Test
    public void touchAppendsAndReorders() {
        Bucket bucket = new Bucket(3);
        bucket.touch(contact(1, 1));
        bucket.touch(contact(2, 2));
        bucket.touch(contact(1, 1));

        Assert.assertEquals(Arrays.asList(contact(2, 2), contact(1, 1)), bucket.snapshot());
        Assert.assertEquals(2, bucket.size());
    }

    @Test
    public void conflictingTouchKeepsExistingEntry() {
        Bucket bucket = new Bucket(3);
        bucket.touch(contact(1, 1));
        bucket.touch(contact(2, 2));

        Assert.assertTrue(bucket.conflicts(contact(1, 99)));
        Assert.assertEquals(Optional.empty(), bucket.touch(contact(1, 99)));

        Assert.assertFalse(bucket.contains(contact(1, 99)));
        Assert.assertEquals(Arrays.asList(contact(1, 1), contact(2, 2)), bucket.snapshot());
    }

    @Test
    public void signalsHeadOnlyWhenOverCapacity() {
        Bucket bucket = new Bucket(2);
        Assert.assertEquals(Optional.empty(), bucket.touch(contact(1, 1)));
        Assert.assertEquals(Optional.empty(), bucket.touch(contact(2, 2)));
        Assert.assertEquals(Optional.of(contact(1, 1)), bucket.touch(contact(3, 3)));
        Assert.assertEquals(3, bucket.size());
        Assert.assertEquals(Optional.empty(), bucket.remove(contact(1, 1)));
        Assert.assertEquals(Arrays.asList(contact(2, 2), contact(3, 3)), bucket.snapshot(5));
    }

    @Test
    public void removeByAddressDropsEveryMatch() {
        Bucket bucket = new Bucket(5);
        bucket.touch(contact(1, 1));
        bucket.touch(contact(2, 7));
        bucket.touch(contact(3, 7));

        bucket.removeByAddress(contact(0, 7).getAddress());

        Assert.assertEquals(Collections.singletonList(contact(1, 1)), bucket.snapshot());
        bucket.remove(contact(1, 1));
        Assert.assertTrue(bucket.isEmpty());
    }

    @Test
    public void snapshotIsLimited() {
        Bucket bucket = new Bucket(2);
        for (int i = 1; i <= 3; i++)
            bucket.touch(contact(i, i));
        Assert.assertEquals(Arrays.asList(contact(1, 1), contact(2, 2)), bucket.snapshot(2));
        Assert.assertTrue(bucket.snapshot(0).isEmpty());
    }
}
