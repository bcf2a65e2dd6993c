package io.ledgersim.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.Hashes;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON rendering of UTxOs and outputs.
 *
 * Output shape: {@code {"address": "...", "value": {"lovelace": 1, "<policy>.<name>": 2},
 * "datum": "<hex>", "scriptRef": "<hex>"}}. Datum and scriptRef are omitted when absent.
 */
public final class LedgerJson {
    private static final ObjectMapper JSON = new ObjectMapper();

    private LedgerJson() {}

    public static String toJson(LedgerView ledger) {
        ArrayNode arr = JSON.createArrayNode();
        for (UnspentOutput utxo : ledger.utxos().values()) {
            arr.add(toNode(utxo));
        }
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(arr);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render ledger", e);
        }
    }

    public static ObjectNode toNode(UnspentOutput utxo) {
        ObjectNode node = JSON.createObjectNode();
        node.put("ref", utxo.reference().toString());
        node.setAll(toNode(utxo.output()));
        return node;
    }

    public static ObjectNode toNode(TxOutput out) {
        ObjectNode node = JSON.createObjectNode();
        node.put("address", out.address());
        ObjectNode value = node.putObject("value");
        for (Map.Entry<AssetId, BigInteger> e : out.value().asMap().entrySet()) {
            value.put(e.getKey().toString(), e.getValue());
        }
        if (out.hasDatum()) {
            node.put("datum", Hashes.toHex(out.datum()));
        }
        if (out.hasScriptRef()) {
            node.put("scriptRef", Hashes.toHex(out.scriptRef()));
        }
        return node;
    }

    /** Inverse of {@link #toNode(TxOutput)}. */
    public static TxOutput outputFromNode(JsonNode node) {
        JsonNode address = node.get("address");
        if (address == null || !address.isTextual()) {
            throw new IllegalArgumentException("Output needs a textual 'address'");
        }
        AssetBundle value = AssetBundle.empty();
        JsonNode valueNode = node.path("value");
        Iterator<Map.Entry<String, JsonNode>> fields = valueNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            value = value.with(parseAssetId(f.getKey()), new BigInteger(f.getValue().asText()));
        }
        byte[] datum = node.hasNonNull("datum") ? Hashes.fromHex(node.get("datum").asText()) : null;
        byte[] scriptRef = node.hasNonNull("scriptRef") ? Hashes.fromHex(node.get("scriptRef").asText()) : null;
        return new TxOutput(address.asText(), value, datum, scriptRef);
    }

    static AssetId parseAssetId(String key) {
        if ("lovelace".equals(key)) {
            return AssetId.LOVELACE;
        }
        int dot = key.indexOf('.');
        if (dot < 0) {
            return new AssetId(key, "");
        }
        return new AssetId(key.substring(0, dot), key.substring(dot + 1));
    }
}
