package cloud.oro.identity.store;

import cloud.oro.identity.DIDStoreException;
import cloud.oro.identity.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads and saves whole-store snapshots as a single JSON document:
 * {@code {"nodes": [...], "clusters": [...], "proofs": [...]}}.
 *
 * <p>
 * The intended cycle is load, construct a {@link cloud.oro.identity.DIDManager} over the returned store, run
 * operations, then save. Snapshots never contain private keys.
 * </p>
 */
public final class JsonSnapshotStore {

    private static final Logger LOGGER = Logger.getLogger(JsonSnapshotStore.class.getName());

    private final Path path;

    public JsonSnapshotStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Reads the snapshot into a fresh {@link InMemoryDIDStore}. A missing file yields an empty store.
     *
     * @throws DIDStoreException when the file cannot be read or does not hold a valid snapshot.
     */
    public InMemoryDIDStore load() throws DIDStoreException {
        InMemoryDIDStore store = new InMemoryDIDStore();
        if (!Files.exists(path)) {
            LOGGER.fine(() -> "[oro-identity] no identity store at " + path + ", starting empty");
            return store;
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = Json.mapper().readTree(in);
        } catch (IOException ex) {
            throw new DIDStoreException("read identity store " + path + ": " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new DIDStoreException("decode identity store " + path + ": expected a JSON object");
        }

        try {
            for (JsonNode node : root.path("nodes")) {
                store.saveNode(SnapshotCodec.decodeNode(node));
            }
            for (JsonNode cluster : root.path("clusters")) {
                store.saveCluster(SnapshotCodec.decodeCluster(cluster));
            }
            for (JsonNode proof : root.path("proofs")) {
                store.saveProof(SnapshotCodec.decodeProof(proof));
            }
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new DIDStoreException("decode identity store " + path + ": " + ex.getMessage(), ex);
        }

        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[oro-identity] loaded identity store %s (nodes=%d clusters=%d proofs=%d)",
            path, store.listNodes().size(), store.listClusters().size(), store.listProofs().size()));
        return store;
    }

    /**
     * Writes {@code store} to the snapshot file, creating parent directories as needed. The document is written to
     * a sibling temporary file first and moved into place.
     *
     * @throws DIDStoreException when the snapshot cannot be written.
     */
    public void save(DIDStore store) throws DIDStoreException {
        Objects.requireNonNull(store, "store");
        ObjectNode root = toJson(store);

        Path target = path.toAbsolutePath();
        Path temp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            Json.mapper().writeValue(temp.toFile(), root);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new DIDStoreException("write identity store " + path + ": " + ex.getMessage(), ex);
        }
        LOGGER.fine(() -> "[oro-identity] saved identity store " + path);
    }

    /**
     * Renders a store as the snapshot document without touching the file system.
     */
    public static ObjectNode toJson(DIDStore store) {
        ObjectNode root = Json.mapper().createObjectNode();
        store.lock().readLock().lock();
        try {
            ArrayNode nodes = root.putArray("nodes");
            store.listNodes().forEach(node -> nodes.add(SnapshotCodec.encodeNode(node)));
            ArrayNode clusters = root.putArray("clusters");
            store.listClusters().forEach(cluster -> clusters.add(SnapshotCodec.encodeCluster(cluster)));
            ArrayNode proofs = root.putArray("proofs");
            store.listProofs().forEach(proof -> proofs.add(SnapshotCodec.encodeProof(proof)));
        } finally {
            store.lock().readLock().unlock();
        }
        return root;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            LOGGER.warning(() -> "[oro-identity] could not remove temporary file " + temp + ": " + cleanup.getMessage());
        }
    }
}
