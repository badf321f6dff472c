package cloud.oro.identity.cli;

import cloud.oro.identity.DIDException;
import cloud.oro.identity.DIDManager;
import cloud.oro.identity.DIDNode;
import cloud.oro.identity.IdentityCluster;
import cloud.oro.identity.LinkProof;
import cloud.oro.identity.store.InMemoryDIDStore;
import cloud.oro.identity.store.JsonSnapshotStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "identity",
        mixinStandardHelpOptions = true,
        version = "oro-identity 0.1.0",
        description = "Multi-DID identity management",
        subcommands = {
                IdentityCommand.ListCommand.class,
                IdentityCommand.CreateCommand.class,
                IdentityCommand.LinkCommand.class,
                IdentityCommand.RevokeCommand.class,
                IdentityCommand.ResolveCommand.class
        }
)
public final class IdentityCommand implements Callable<Integer> {

    static final String DEFAULT_STORE_PATH = "~/.valence/identity_store.json";

    @Spec
    CommandSpec spec;

    @Option(names = {"--store"}, description = "Path to identity store file", defaultValue = DEFAULT_STORE_PATH)
    String store;

    public static void main(String[] args) {
        System.exit(new CommandLine(new IdentityCommand()).execute(args));
    }

    @Override
    public Integer call() {
        err().println("Usage: identity [--store PATH] {list,create,link,revoke,resolve}");
        return 1;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    JsonSnapshotStore snapshot() {
        return new JsonSnapshotStore(resolveStorePath(store));
    }

    static Path resolveStorePath(String value) {
        String path = value == null || value.isBlank() ? DEFAULT_STORE_PATH : value.trim();
        if (path.equals("~") || path.startsWith("~/")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return Path.of(path);
    }

    /**
     * Runs {@code action}, turning identity failures into a message on stderr and exit code 1.
     */
    int execute(IdentityAction action) {
        try {
            return action.run();
        } catch (DIDException ex) {
            err().println("error: " + ex.getMessage());
            return 1;
        }
    }

    @FunctionalInterface
    interface IdentityAction {
        int run() throws DIDException;
    }

    @Command(name = "list", description = "List all DIDs and clusters")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        IdentityCommand parent;

        @Option(names = {"--json", "-j"}, description = "Output as JSON")
        boolean json;

        @Override
        public Integer call() {
            return parent.execute(() -> {
                DIDManager manager = new DIDManager(parent.snapshot().load());
                List<DIDNode> nodes = manager.listNodes();
                List<IdentityCluster> clusters = manager.listClusters();
                ConsoleRenderer renderer = new ConsoleRenderer(parent.out());
                if (json) {
                    try {
                        renderer.json(nodes, clusters);
                    } catch (JsonProcessingException ex) {
                        throw new DIDException("render identity store: " + ex.getMessage(), ex);
                    }
                    return 0;
                }
                Map<String, IdentityCluster> byId = new LinkedHashMap<>();
                clusters.forEach(cluster -> byId.put(cluster.clusterId(), cluster));
                renderer.nodeTable(nodes, clusters, byId);
                return 0;
            });
        }
    }

    @Command(name = "create", description = "Create a new DID; the private key is printed once")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        IdentityCommand parent;

        @Parameters(index = "0", description = "Label for the new node")
        String label;

        @Override
        public Integer call() {
            return parent.execute(() -> {
                JsonSnapshotStore snapshot = parent.snapshot();
                InMemoryDIDStore store = snapshot.load();
                DIDNode node = new DIDManager(store).createDid(label);
                snapshot.save(store);
                PrintWriter out = parent.out();
                out.println("Created: " + node.getDid() + " (" + node.getLabel() + ")");
                out.println("Private key: " + Hex.toHexString(node.getPrivateKey()));
                out.println("Store this key now; it is not saved and cannot be shown again.");
                return 0;
            });
        }
    }

    @Command(name = "link", description = "Link two DIDs, or show their link status when no keys are given")
    static final class LinkCommand implements Callable<Integer> {
        @ParentCommand
        IdentityCommand parent;

        @Parameters(index = "0", description = "First DID")
        String didA;

        @Parameters(index = "1", description = "Second DID")
        String didB;

        @Option(names = {"--key-a"}, description = "Hex private key of the first DID")
        String keyA;

        @Option(names = {"--key-b"}, description = "Hex private key of the second DID")
        String keyB;

        @Override
        public Integer call() {
            return parent.execute(() -> {
                if (didA.equals(didB)) {
                    parent.err().println("error: cannot link a DID to itself: " + didA);
                    return 1;
                }
                JsonSnapshotStore snapshot = parent.snapshot();
                InMemoryDIDStore store = snapshot.load();
                DIDManager manager = new DIDManager(store);
                PrintWriter out = parent.out();

                if (keyA == null && keyB == null) {
                    return status(manager, out);
                }
                if (keyA == null || keyB == null) {
                    parent.err().println("error: linking requires both --key-a and --key-b");
                    return 1;
                }

                LinkProof proof = manager.linkDids(didA, decodeKey(keyA, "--key-a"), didB, decodeKey(keyB, "--key-b"));
                snapshot.save(store);
                out.println("Linked " + proof.didA() + " and " + proof.didB());
                out.println("Cluster: " + proof.clusterId());
                return 0;
            });
        }

        private int status(DIDManager manager, PrintWriter out) throws DIDException {
            Optional<IdentityCluster> clusterA = manager.resolveIdentity(didA);
            Optional<IdentityCluster> clusterB = manager.resolveIdentity(didB);
            if (clusterA.isPresent() && clusterB.isPresent()
                    && clusterA.get().clusterId().equals(clusterB.get().clusterId())) {
                out.println("Both DIDs already in cluster: "
                        + ConsoleRenderer.clusterName(clusterA.get(), clusterA.get().clusterId()));
                return 0;
            }
            out.println("DID A: " + didA + " (cluster: " + shortId(clusterA) + ")");
            out.println("DID B: " + didB + " (cluster: " + shortId(clusterB) + ")");
            out.println();
            out.println("Linking requires both private keys: pass --key-a and --key-b.");
            return 0;
        }

        private static String shortId(Optional<IdentityCluster> cluster) {
            return ConsoleRenderer.shortId(cluster.map(IdentityCluster::clusterId).orElse(null));
        }

        private static byte[] decodeKey(String hex, String option) throws DIDException {
            try {
                return Hex.decode(hex.trim());
            } catch (DecoderException ex) {
                throw new DIDException(option + " is not a hex encoded key", ex);
            }
        }
    }

    @Command(name = "revoke", description = "Revoke a compromised DID")
    static final class RevokeCommand implements Callable<Integer> {
        @ParentCommand
        IdentityCommand parent;

        @Parameters(index = "0", description = "DID to revoke")
        String did;

        @Option(names = {"--reason", "-r"}, description = "Reason for revocation")
        String reason;

        @Override
        public Integer call() {
            return parent.execute(() -> {
                JsonSnapshotStore snapshot = parent.snapshot();
                InMemoryDIDStore store = snapshot.load();
                DIDNode node = new DIDManager(store).revokeDid(did, reason == null ? "" : reason);
                snapshot.save(store);
                PrintWriter out = parent.out();
                out.println("Revoked: " + node.getDid() + " (" + node.getLabel() + ")");
                if (node.getRevocationReason() != null && !node.getRevocationReason().isEmpty()) {
                    out.println("   Reason: " + node.getRevocationReason());
                }
                return 0;
            });
        }
    }

    @Command(name = "resolve", description = "Show the identity cluster a DID belongs to")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        IdentityCommand parent;

        @Parameters(index = "0", description = "DID to resolve")
        String did;

        @Override
        public Integer call() {
            return parent.execute(() -> {
                Optional<IdentityCluster> cluster = new DIDManager(parent.snapshot().load()).resolveIdentity(did);
                if (cluster.isEmpty()) {
                    parent.out().println(did + " is not linked to any cluster");
                    return 0;
                }
                new ConsoleRenderer(parent.out()).cluster(cluster.get());
                return 0;
            });
        }
    }
}
