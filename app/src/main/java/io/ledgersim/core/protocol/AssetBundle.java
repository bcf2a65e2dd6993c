package io.ledgersim.core.protocol;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable multi-asset quantity: a sparse map from {@link AssetId} to a signed amount.
 *
 * The lovelace entry is always present (possibly zero); zero entries of every other
 * asset are pruned, so two bundles are equal iff they hold the same non-zero amounts.
 * Used both for holdings (all entries &gt;= 0) and for the signed mint field.
 */
public final class AssetBundle {

    private static final AssetBundle ZERO = new AssetBundle(new TreeMap<>());

    private final NavigableMap<AssetId, BigInteger> quantities;

    private AssetBundle(NavigableMap<AssetId, BigInteger> raw) {
        TreeMap<AssetId, BigInteger> pruned = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : raw.entrySet()) {
            if (e.getValue().signum() != 0) {
                pruned.put(e.getKey(), e.getValue());
            }
        }
        pruned.putIfAbsent(AssetId.LOVELACE, BigInteger.ZERO);
        this.quantities = Collections.unmodifiableNavigableMap(pruned);
    }

    public static AssetBundle empty() { return ZERO; }

    public static AssetBundle lovelace(long amount) { return lovelace(BigInteger.valueOf(amount)); }

    public static AssetBundle lovelace(BigInteger amount) {
        return ZERO.with(AssetId.LOVELACE, amount);
    }

    public static AssetBundle singleAsset(AssetId asset, long amount) {
        return ZERO.with(asset, BigInteger.valueOf(amount));
    }

    public static AssetBundle of(Map<AssetId, BigInteger> amounts) {
        TreeMap<AssetId, BigInteger> copy = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : amounts.entrySet()) {
            copy.merge(Objects.requireNonNull(e.getKey(), "asset"),
                    Objects.requireNonNull(e.getValue(), "quantity"), BigInteger::add);
        }
        return new AssetBundle(copy);
    }

    /** Returns a copy with {@code amount} added to {@code asset}. */
    public AssetBundle with(AssetId asset, BigInteger amount) {
        TreeMap<AssetId, BigInteger> copy = new TreeMap<>(quantities);
        copy.merge(Objects.requireNonNull(asset, "asset"), Objects.requireNonNull(amount, "amount"), BigInteger::add);
        return new AssetBundle(copy);
    }

    public AssetBundle with(AssetId asset, long amount) {
        return with(asset, BigInteger.valueOf(amount));
    }

    // -------------------- algebra --------------------

    public AssetBundle add(AssetBundle other) {
        TreeMap<AssetId, BigInteger> sum = new TreeMap<>(quantities);
        for (Map.Entry<AssetId, BigInteger> e : other.quantities.entrySet()) {
            sum.merge(e.getKey(), e.getValue(), BigInteger::add);
        }
        return new AssetBundle(sum);
    }

    public AssetBundle scale(BigInteger k) {
        TreeMap<AssetId, BigInteger> scaled = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : quantities.entrySet()) {
            scaled.put(e.getKey(), e.getValue().multiply(k));
        }
        return new AssetBundle(scaled);
    }

    public AssetBundle scale(long k) { return scale(BigInteger.valueOf(k)); }

    public AssetBundle negate() { return scale(BigInteger.ONE.negate()); }

    public AssetBundle subtract(AssetBundle other) { return add(other.negate()); }

    /** Entries &gt; 0 only (for a mint field: what is minted). */
    public AssetBundle positivePart() {
        TreeMap<AssetId, BigInteger> out = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : quantities.entrySet()) {
            if (e.getValue().signum() > 0) out.put(e.getKey(), e.getValue());
        }
        return new AssetBundle(out);
    }

    /** Magnitudes of entries &lt; 0 (for a mint field: what is burned). */
    public AssetBundle negativePart() {
        TreeMap<AssetId, BigInteger> out = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : quantities.entrySet()) {
            if (e.getValue().signum() < 0) out.put(e.getKey(), e.getValue().negate());
        }
        return new AssetBundle(out);
    }

    // -------------------- queries --------------------

    public boolean isZero() {
        for (BigInteger q : quantities.values()) {
            if (q.signum() != 0) return false;
        }
        return true;
    }

    public boolean hasNegative() {
        for (BigInteger q : quantities.values()) {
            if (q.signum() < 0) return true;
        }
        return false;
    }

    public BigInteger lovelace() {
        return quantities.get(AssetId.LOVELACE);
    }

    public BigInteger quantityOf(AssetId asset) {
        return quantities.getOrDefault(asset, BigInteger.ZERO);
    }

    /** Asset ids with a recorded entry (lovelace always included), in canonical order. */
    public SortedSet<AssetId> assetIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(quantities.keySet()));
    }

    public NavigableMap<AssetId, BigInteger> asMap() {
        return quantities;
    }

    public int nonBaseAssetCount() {
        return quantities.size() - 1;
    }

    /** Native assets grouped by policy id, then asset name; lovelace excluded. */
    public SortedMap<String, SortedMap<String, BigInteger>> policies() {
        SortedMap<String, SortedMap<String, BigInteger>> out = new TreeMap<>();
        for (Map.Entry<AssetId, BigInteger> e : quantities.entrySet()) {
            AssetId id = e.getKey();
            if (id.isLovelace()) continue;
            out.computeIfAbsent(id.policyId(), k -> new TreeMap<>()).put(id.assetName(), e.getValue());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetBundle)) return false;
        return quantities.equals(((AssetBundle) o).quantities);
    }

    @Override
    public int hashCode() {
        return quantities.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<AssetId, BigInteger> e : quantities.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.append('}').toString();
    }
}
