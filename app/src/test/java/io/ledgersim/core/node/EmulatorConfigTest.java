package io.ledgersim.core.node;

import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.UnspentOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EmulatorConfigTest {

    @TempDir
    Path tmp;

    @Test
    void defaultsMirrorMainnet() {
        EmulatorConfig config = EmulatorConfig.defaultLocal();
        assertEquals(1_506_203_091_000L, config.genesis.startTimeMs);
        assertEquals(BigInteger.valueOf(44), config.params.txFeePerByte);
        assertEquals(90_112L * EmulatorConfig.DEFAULT_MEMPOOL_BLOCKS, config.maxMempoolBytes);
        assertTrue(config.initialUtxos.isEmpty());
    }

    @Test
    void missingKeysFallBackToDefaults() {
        EmulatorConfig config = EmulatorConfig.fromJson("""
                {"protocolParameters": {"txFeeFixed": 0, "maxBlockBodySize": 4096}}
                """);

        ProtocolParameters defaults = ProtocolParameters.defaultMainnet();
        assertEquals(BigInteger.ZERO, config.params.txFeeFixed);
        assertEquals(defaults.txFeePerByte, config.params.txFeePerByte);
        assertEquals(4096L, config.params.maxBlockBodySize);
        assertEquals(4096L * EmulatorConfig.DEFAULT_MEMPOOL_BLOCKS, config.maxMempoolBytes);
        assertEquals(432_000L, config.genesis.epochLengthSlots);
        assertEquals(0L, config.initialSlot);
    }

    @Test
    void loadsGenesisUtxosFromFile() throws Exception {
        Path file = tmp.resolve("emulator.json");
        String policy = "1f".repeat(28);
        Files.writeString(file, """
                {
                  "genesis": {"startTimeMs": 0, "slotLengthMs": 200, "epochLengthSlots": 100},
                  "initialSlot": 40,
                  "maxMempoolBytes": 50000,
                  "initialUtxos": [
                    {"address": "addr_test1qalice00000", "value": {"lovelace": 5000000}},
                    {"address": "addr_test1qbob0000000",
                     "value": {"lovelace": 3000000, "%s.746f6b656e": 10},
                     "datum": "cafe"}
                  ]
                }
                """.formatted(policy), StandardCharsets.UTF_8);

        EmulatorConfig config = EmulatorConfig.load(file);

        assertEquals(200L, config.genesis.slotLengthMs);
        assertEquals(40L, config.initialSlot);
        assertEquals(50_000L, config.maxMempoolBytes);
        assertEquals(2, config.initialUtxos.size());
        UnspentOutput second = config.initialUtxos.get(1);
        assertEquals(GenesisBuilder.genesisReference(1), second.reference());
        assertEquals(BigInteger.TEN, second.value().quantityOf(AssetId.of(policy, "token")));
        assertTrue(second.output().hasDatum());

        Emulator emulator = new Emulator(config);
        assertEquals(40L, emulator.getCurrentSlot());
        assertEquals(8_000L, emulator.getCurrentTime());
        assertEquals(2, emulator.getUtxos().size());
    }

    @Test
    void explicitReferenceIsKept() {
        String ref = GenesisBuilder.GENESIS_TX_ID.hex() + "#7";
        EmulatorConfig config = EmulatorConfig.fromJson(
                "{\"initialUtxos\": [{\"ref\": \"" + ref + "\", \"address\": \"addr_test1qalice00000\","
                        + " \"value\": {\"lovelace\": 1}}]}");
        assertEquals(ref, config.initialUtxos.get(0).reference().toString());
    }

    @Test
    void malformedJsonIsWrapped() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{not json"));
        assertNotNull(ex.getCause());
    }

    @Test
    void blankInputIsRejected() {
        assertThrows(IllegalStateException.class, () -> EmulatorConfig.fromJson(""));
        assertThrows(IllegalStateException.class, () -> EmulatorConfig.fromJson("   "));
        assertThrows(IllegalStateException.class, () -> EmulatorConfig.fromJson("[]"));
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        Path file = tmp.resolve("empty.json");
        Files.writeString(file, "", StandardCharsets.UTF_8);
        assertThrows(IllegalStateException.class, () -> EmulatorConfig.load(file));
    }

    @Test
    void nonNumericValuesAreRejectedNotDefaulted() {
        IllegalStateException slot = assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"initialSlot\": \"abc\"}"));
        assertTrue(slot.getMessage().contains("initialSlot"), slot.getMessage());

        assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"genesis\": {\"slotLengthMs\": \"fast\"}}"));
        assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"protocolParameters\": {\"activeSlotCoefficient\": true}}"));
        assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"protocolParameters\": {\"txFeeFixed\": \"lots\"}}"));
    }

    @Test
    void largeFeeParametersMayBeDecimalStrings() {
        EmulatorConfig config = EmulatorConfig.fromJson("{\"protocolParameters\": {\"txFeeFixed\": \"200000\"}}");
        assertEquals(BigInteger.valueOf(200_000L), config.params.txFeeFixed);
    }

    @Test
    void invalidValuesAreReportedAsMalformedConfig() {
        assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"genesis\": {\"slotLengthMs\": 0}}"));
        assertThrows(IllegalStateException.class,
                () -> EmulatorConfig.fromJson("{\"initialUtxos\": [{\"value\": {\"lovelace\": 1}}]}"));
    }

    @Test
    void missingFileIsWrapped() {
        assertThrows(IllegalStateException.class, () -> EmulatorConfig.load(tmp.resolve("absent.json")));
    }

    @Test
    void withersReplaceOneField() {
        EmulatorConfig base = EmulatorConfig.defaultLocal();
        EmulatorConfig changed = base.withInitialSlot(100).withMaxMempoolBytes(1_000);
        assertEquals(100L, changed.initialSlot);
        assertEquals(1_000L, changed.maxMempoolBytes);
        assertSame(base.params, changed.params);
        assertThrows(IllegalArgumentException.class, () -> base.withMaxMempoolBytes(0));
    }
}
