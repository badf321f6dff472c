package cloud.oro.identity.cli;

import cloud.oro.identity.DIDNode;
import cloud.oro.identity.IdentityCluster;
import cloud.oro.identity.store.SnapshotCodec;
import cloud.oro.identity.internal.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable and JSON rendering for the {@code identity} commands.
 */
final class ConsoleRenderer {

    private static final String ROW_FORMAT = "%-45s %-15s %-8s %s%n";

    private final PrintWriter out;

    ConsoleRenderer(PrintWriter out) {
        this.out = out;
    }

    void nodeTable(List<DIDNode> nodes, List<IdentityCluster> clusters, Map<String, IdentityCluster> byId) {
        if (nodes.isEmpty()) {
            out.println("No DIDs registered.");
            return;
        }
        out.printf(Locale.ROOT, ROW_FORMAT, "DID", "Label", "Status", "Cluster");
        out.println("-".repeat(95));
        for (DIDNode node : nodes) {
            IdentityCluster cluster = node.getClusterId() == null ? null : byId.get(node.getClusterId());
            out.printf(Locale.ROOT, ROW_FORMAT, node.getDid(), node.getLabel(), node.getStatus().value(),
                clusterName(cluster, node.getClusterId()));
        }
        if (!clusters.isEmpty()) {
            out.printf(Locale.ROOT, "%n%d cluster(s), %d DID(s) total%n", clusters.size(), nodes.size());
        }
    }

    void json(List<DIDNode> nodes, List<IdentityCluster> clusters) throws JsonProcessingException {
        ObjectNode root = Json.mapper().createObjectNode();
        ArrayNode nodeArray = root.putArray("nodes");
        nodes.forEach(node -> nodeArray.add(SnapshotCodec.encodeNode(node)));
        ArrayNode clusterArray = root.putArray("clusters");
        clusters.forEach(cluster -> clusterArray.add(SnapshotCodec.encodeCluster(cluster)));
        out.println(Json.mapper().writeValueAsString(root));
    }

    void cluster(IdentityCluster cluster) {
        out.printf(Locale.ROOT, "Cluster %s%s%n", cluster.clusterId(),
            cluster.label() == null ? "" : " (" + cluster.label() + ")");
        for (String member : cluster.memberDids()) {
            out.println("  " + member);
        }
    }

    static String clusterName(IdentityCluster cluster, String clusterId) {
        if (cluster != null && cluster.label() != null && !cluster.label().isBlank()) {
            return cluster.label();
        }
        return shortId(clusterId);
    }

    static String shortId(String clusterId) {
        if (clusterId == null) {
            return "none";
        }
        return clusterId.length() <= 8 ? clusterId : clusterId.substring(0, 8);
    }
}
