package io.ledgersim.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgersim.core.clock.GenesisInfo;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;
import io.ledgersim.core.state.LedgerJson;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Config holder for a local emulator. */
public final class EmulatorConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Mempool capacity as a multiple of the block body limit when not configured. */
    public static final long DEFAULT_MEMPOOL_BLOCKS = 8L;

    public final GenesisInfo genesis;
    public final ProtocolParameters params;
    public final long initialSlot;
    public final long maxMempoolBytes;
    public final List<UnspentOutput> initialUtxos;

    public EmulatorConfig(GenesisInfo genesis, ProtocolParameters params, long initialSlot,
                          long maxMempoolBytes, List<UnspentOutput> initialUtxos) {
        if (initialSlot < 0) {
            throw new IllegalArgumentException("initialSlot must be >= 0");
        }
        if (maxMempoolBytes <= 0) {
            throw new IllegalArgumentException("maxMempoolBytes must be > 0");
        }
        this.genesis = genesis;
        this.params = params;
        this.initialSlot = initialSlot;
        this.maxMempoolBytes = maxMempoolBytes;
        this.initialUtxos = List.copyOf(initialUtxos);
    }

    public static EmulatorConfig defaultLocal() {
        ProtocolParameters params = ProtocolParameters.defaultMainnet();
        return new EmulatorConfig(
                GenesisInfo.defaultMainnet(),
                params,
                0L,
                params.maxBlockBodySize * DEFAULT_MEMPOOL_BLOCKS,
                List.of()
        );
    }

    public EmulatorConfig withGenesis(GenesisInfo g) {
        return new EmulatorConfig(g, params, initialSlot, maxMempoolBytes, initialUtxos);
    }

    public EmulatorConfig withProtocolParameters(ProtocolParameters p) {
        return new EmulatorConfig(genesis, p, initialSlot, maxMempoolBytes, initialUtxos);
    }

    public EmulatorConfig withInitialSlot(long slot) {
        return new EmulatorConfig(genesis, params, slot, maxMempoolBytes, initialUtxos);
    }

    public EmulatorConfig withMaxMempoolBytes(long bytes) {
        return new EmulatorConfig(genesis, params, initialSlot, bytes, initialUtxos);
    }

    public EmulatorConfig withInitialUtxos(List<UnspentOutput> utxos) {
        return new EmulatorConfig(genesis, params, initialSlot, maxMempoolBytes, utxos);
    }

    public static EmulatorConfig load(Path path) {
        try {
            return fromNode(JSON.readTree(path.toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read emulator config from " + path, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid emulator config in " + path + ": " + e.getMessage(), e);
        }
    }

    public static EmulatorConfig fromJson(String json) {
        try {
            return fromNode(JSON.readTree(json));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse emulator config", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid emulator config: " + e.getMessage(), e);
        }
    }

    private static EmulatorConfig fromNode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Emulator config must be a JSON object");
        }
        GenesisInfo defGenesis = GenesisInfo.defaultMainnet();
        JsonNode g = root.path("genesis");
        GenesisInfo genesis = new GenesisInfo(
                longOr(g, "startTimeMs", defGenesis.startTimeMs),
                longOr(g, "slotLengthMs", defGenesis.slotLengthMs),
                longOr(g, "epochLengthSlots", defGenesis.epochLengthSlots));

        ProtocolParameters defParams = ProtocolParameters.defaultMainnet();
        JsonNode p = root.path("protocolParameters");
        ProtocolParameters params = new ProtocolParameters(
                bigOr(p, "txFeePerByte", defParams.txFeePerByte),
                bigOr(p, "txFeeFixed", defParams.txFeeFixed),
                longOr(p, "maxTxSize", defParams.maxTxSize),
                longOr(p, "maxBlockBodySize", defParams.maxBlockBodySize),
                bigOr(p, "coinsPerUtxoByte", defParams.coinsPerUtxoByte),
                doubleOr(p, "activeSlotCoefficient", defParams.activeSlotCoefficient));

        long initialSlot = longOr(root, "initialSlot", 0L);
        long maxMempoolBytes = longOr(root, "maxMempoolBytes", params.maxBlockBodySize * DEFAULT_MEMPOOL_BLOCKS);

        List<UnspentOutput> utxos = new ArrayList<>();
        JsonNode arr = root.path("initialUtxos");
        if (!arr.isMissingNode() && !arr.isArray()) {
            throw new IllegalStateException("initialUtxos must be an array");
        }
        int i = 0;
        for (JsonNode n : arr) {
            TxOutput out = LedgerJson.outputFromNode(n);
            OutputReference ref = n.hasNonNull("ref")
                    ? OutputReference.parse(n.get("ref").asText())
                    : GenesisBuilder.genesisReference(i);
            utxos.add(new UnspentOutput(ref, out));
            i++;
        }
        return new EmulatorConfig(genesis, params, initialSlot, maxMempoolBytes, utxos);
    }

    // Absent or null keys take the default; anything else must be a number.

    private static long longOr(JsonNode parent, String field, long fallback) {
        JsonNode n = parent.get(field);
        if (n == null || n.isNull()) {
            return fallback;
        }
        if (!n.isIntegralNumber() || !n.canConvertToLong()) {
            throw new IllegalStateException(field + " must be an integer, got " + n);
        }
        return n.asLong();
    }

    private static double doubleOr(JsonNode parent, String field, double fallback) {
        JsonNode n = parent.get(field);
        if (n == null || n.isNull()) {
            return fallback;
        }
        if (!n.isNumber()) {
            throw new IllegalStateException(field + " must be a number, got " + n);
        }
        return n.asDouble();
    }

    /** Also accepts a decimal string, for quantities beyond JSON's safe integer range. */
    private static BigInteger bigOr(JsonNode parent, String field, BigInteger fallback) {
        JsonNode n = parent.get(field);
        if (n == null || n.isNull()) {
            return fallback;
        }
        if (n.isIntegralNumber()) {
            return n.bigIntegerValue();
        }
        if (n.isTextual()) {
            try {
                return new BigInteger(n.asText());
            } catch (NumberFormatException e) {
                throw new IllegalStateException(field + " must be an integer, got " + n, e);
            }
        }
        throw new IllegalStateException(field + " must be an integer, got " + n);
    }

    @Override public String toString() {
        return "EmulatorConfig{" + genesis + ", " + params + ", initialSlot=" + initialSlot
                + ", maxMempoolBytes=" + maxMempoolBytes + ", initialUtxos=" + initialUtxos.size() + "}";
    }
}
