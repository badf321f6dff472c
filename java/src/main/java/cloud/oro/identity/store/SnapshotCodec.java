package cloud.oro.identity.store;

import cloud.oro.identity.DIDNode;
import cloud.oro.identity.DIDStatus;
import cloud.oro.identity.IdentityCluster;
import cloud.oro.identity.LinkProof;
import cloud.oro.identity.Signature;
import cloud.oro.identity.internal.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps nodes, clusters and proofs to and from the JSON shape used by persisted snapshots. Private keys are never
 * written.
 */
public final class SnapshotCodec {

    private SnapshotCodec() {
    }

    public static ObjectNode encodeNode(DIDNode node) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("did", node.getDid());
        json.put("public_key", Base64.getEncoder().encodeToString(node.getPublicKey()));
        json.put("label", node.getLabel());
        json.put("status", node.getStatus().value());
        putNullable(json, "cluster_id", node.getClusterId());
        putInstant(json, "created_at", node.getCreatedAt());
        putInstant(json, "revoked_at", node.getRevokedAt());
        putNullable(json, "revocation_reason", node.getRevocationReason());
        return json;
    }

    public static DIDNode decodeNode(JsonNode json) {
        return DIDNode.builder()
            .did(required(json, "did"))
            .publicKey(base64(required(json, "public_key"), "public_key"))
            .label(json.path("label").asText(""))
            .status(DIDStatus.fromValue(required(json, "status")))
            .clusterId(optional(json, "cluster_id"))
            .createdAt(instant(json, "created_at"))
            .revokedAt(optionalInstant(json, "revoked_at"))
            .revocationReason(optional(json, "revocation_reason"))
            .build();
    }

    public static ObjectNode encodeCluster(IdentityCluster cluster) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("cluster_id", cluster.clusterId());
        putNullable(json, "label", cluster.label());
        ArrayNode members = json.putArray("member_dids");
        cluster.memberDids().forEach(members::add);
        putInstant(json, "created_at", cluster.createdAt());
        return json;
    }

    public static IdentityCluster decodeCluster(JsonNode json) {
        Set<String> members = new LinkedHashSet<>();
        for (JsonNode member : json.path("member_dids")) {
            String did = member.asText();
            if (did != null && !did.isBlank()) {
                members.add(did);
            }
        }
        return new IdentityCluster(
            required(json, "cluster_id"),
            optional(json, "label"),
            members,
            instant(json, "created_at")
        );
    }

    public static ObjectNode encodeProof(LinkProof proof) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("did_a", proof.didA());
        json.put("did_b", proof.didB());
        json.set("signature_a", encodeSignature(proof.signatureA()));
        json.set("signature_b", encodeSignature(proof.signatureB()));
        json.put("cluster_id", proof.clusterId());
        putInstant(json, "created_at", proof.createdAt());
        return json;
    }

    public static LinkProof decodeProof(JsonNode json) {
        return new LinkProof(
            required(json, "did_a"),
            required(json, "did_b"),
            decodeSignature(json.path("signature_a"), "signature_a"),
            decodeSignature(json.path("signature_b"), "signature_b"),
            required(json, "cluster_id"),
            instant(json, "created_at")
        );
    }

    private static ObjectNode encodeSignature(Signature signature) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("algorithm", signature.algorithm());
        json.put("value", signature.value());
        putNullable(json, "key_id", signature.keyId());
        return json;
    }

    private static Signature decodeSignature(JsonNode json, String field) {
        if (!json.isObject()) {
            throw new IllegalArgumentException("field " + field + " must be an object");
        }
        return new Signature(required(json, "algorithm"), required(json, "value"), optional(json, "key_id"));
    }

    private static void putNullable(ObjectNode json, String field, String value) {
        if (value == null) {
            json.putNull(field);
        } else {
            json.put(field, value);
        }
    }

    private static String required(JsonNode json, String field) {
        String value = optional(json, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing field " + field);
        }
        return value;
    }

    private static String optional(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void putInstant(ObjectNode json, String field, Instant value) {
        if (value == null) {
            json.putNull(field);
        } else {
            json.set(field, Json.mapper().valueToTree(value));
        }
    }

    private static Instant optionalInstant(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
            return null;
        }
        return instant(json, field);
    }

    private static Instant instant(JsonNode json, String field) {
        required(json, field);
        try {
            return Json.mapper().treeToValue(json.get(field), Instant.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("field " + field + " is not an ISO-8601 instant", ex);
        }
    }

    private static byte[] base64(String value, String field) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("field " + field + " is not valid base64", ex);
        }
    }
}
