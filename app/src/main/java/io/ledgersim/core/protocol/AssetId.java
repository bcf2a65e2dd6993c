package io.ledgersim.core.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one kind of asset: either the base currency (lovelace) or a
 * native asset named by a 28-byte policy id and an asset name of at most 32 bytes.
 *
 * Ordering puts the base currency first, then sorts by policy id and asset name
 * (both as unsigned bytes, which is what comparing the lowercase hex gives).
 */
public final class AssetId implements Comparable<AssetId> {

    public static final int POLICY_ID_BYTES = 28;
    public static final int MAX_ASSET_NAME_BYTES = 32;

    public static final AssetId LOVELACE = new AssetId("", "");

    private static final Comparator<AssetId> ORDER = Comparator
            .comparing((AssetId a) -> !a.isLovelace())
            .thenComparing(AssetId::policyId)
            .thenComparing(AssetId::assetName);

    private final String policyId;
    private final String assetName;

    public AssetId(String policyId, String assetName) {
        if (policyId == null || assetName == null) {
            throw new IllegalArgumentException("policyId and assetName required");
        }
        policyId = policyId.toLowerCase(Locale.ROOT);
        assetName = assetName.toLowerCase(Locale.ROOT);
        if (!policyId.isEmpty()) {
            if (Hashes.fromHex(policyId).length != POLICY_ID_BYTES) {
                throw new IllegalArgumentException("Policy id must be " + POLICY_ID_BYTES + " bytes: " + policyId);
            }
            if (Hashes.fromHex(assetName).length > MAX_ASSET_NAME_BYTES) {
                throw new IllegalArgumentException("Asset name longer than " + MAX_ASSET_NAME_BYTES + " bytes");
            }
        } else if (!assetName.isEmpty()) {
            throw new IllegalArgumentException("Base currency has no asset name");
        }
        this.policyId = policyId;
        this.assetName = assetName;
    }

    /** Native asset whose name is given as UTF-8 text. */
    public static AssetId of(String policyIdHex, String utf8Name) {
        return new AssetId(policyIdHex, Hashes.toHex(utf8Name.getBytes(StandardCharsets.UTF_8)));
    }

    public String policyId() { return policyId; }
    public String assetName() { return assetName; }

    public boolean isLovelace() {
        return policyId.isEmpty();
    }

    public byte[] policyBytes() { return Hashes.fromHex(policyId); }
    public byte[] nameBytes() { return Hashes.fromHex(assetName); }

    @Override
    public int compareTo(AssetId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetId)) return false;
        AssetId other = (AssetId) o;
        return policyId.equals(other.policyId) && assetName.equals(other.assetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policyId, assetName);
    }

    @Override
    public String toString() {
        return isLovelace() ? "lovelace" : policyId + "." + assetName;
    }
}
