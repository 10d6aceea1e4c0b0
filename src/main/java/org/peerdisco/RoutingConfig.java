package org.peerdisco;

import org.apache.commons.lang3.Validate;
import org.peerdisco.kademlia.NodeId;

import java.security.SecureRandom;
import java.util.*;

/**
 * Settings for one node's routing table.
 */
public class RoutingConfig {

    public static final String NODE_ID = "node-id";
    public static final String ID_BYTES = "id-bytes";
    public static final String BUCKET_SIZE = "bucket-size";

    public static final int DEFAULT_ID_BYTES = 32;
    public static final int DEFAULT_BUCKET_SIZE = 20;

    public final NodeId localId;
    public final int bucketSize;

    public RoutingConfig(NodeId localId, int bucketSize) {
        Validate.notNull(localId);
        Validate.isTrue(bucketSize > 0, "Bucket size must be positive: %d", bucketSize);
        this.localId = localId;
        this.bucketSize = bucketSize;
    }

    /**
     * Reads {@code node-id} (hex), {@code id-bytes} and {@code bucket-size}. Without a {@code node-id} a random ID of {@code id-bytes}
     * bytes is generated.
     */
    public static RoutingConfig fromArgs(Args args) {
        int idBytes = args.getInt(ID_BYTES, DEFAULT_ID_BYTES);
        if (idBytes <= 0)
            throw new IllegalStateException("Invalid " + ID_BYTES + ": " + idBytes);
        int bucketSize = args.getInt(BUCKET_SIZE, DEFAULT_BUCKET_SIZE);
        if (bucketSize <= 0)
            throw new IllegalStateException("Invalid " + BUCKET_SIZE + ": " + bucketSize);

        Optional<String> hex = args.getOptionalArg(NODE_ID);
        NodeId localId;
        if (hex.isPresent()) {
            try {
                localId = NodeId.fromHex(hex.get().trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid " + NODE_ID + ": " + hex.get(), e);
            }
            if (args.hasArg(ID_BYTES) && localId.getBitLength() != idBytes * 8)
                throw new IllegalStateException(NODE_ID + " is " + localId.getBitLength() / 8 + " bytes, but " + ID_BYTES + " is " + idBytes);
        } else {
            localId = NodeId.random(new SecureRandom(), idBytes);
        }
        return new RoutingConfig(localId, bucketSize);
    }

    public RoutingEngine buildEngine() {
        return new RoutingEngine(localId, bucketSize);
    }

    @Override
    public String toString() {
        Map<String, Object> configMap = new LinkedHashMap<>();
        configMap.put(NODE_ID, localId.toHex());
        configMap.put(BUCKET_SIZE, bucketSize);
        return configMap.toString();
    }
}
