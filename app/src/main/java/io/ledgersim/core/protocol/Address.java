package io.ledgersim.core.protocol;

public final class Address {
    public static final int MIN_ADDRESS_LEN = 8;
    public static final int MAX_ADDRESS_LEN = 128;

    private Address(){}

    /** Loose shape check for bech32-style and hex addresses; not a checksum validation. */
    public static boolean isValid(String addr) {
        if (addr == null) return false;
        int len = addr.length();
        if (len < MIN_ADDRESS_LEN || len > MAX_ADDRESS_LEN) return false;
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
            if (!ok) return false;
        }
        return true;
    }
}
