package com.collectible.market.collectible_market.ledger;

import java.util.Locale;

public final class Currencies {

    /**
     * Sentinel address for the chain's native currency.
     */
    public static final String NATIVE_TOKEN = "0xEeeeeEeeeEeEeeEeEeEeeEEEeeeeEeeeeeeeEEeE";

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private Currencies() {
    }

    /**
     * Canonical form of an address: trimmed and lower-cased. Records, ledger keys
     * and approval sets only ever hold canonical addresses.
     */
    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isNative(String currency) {
        return NATIVE_TOKEN.equalsIgnoreCase(currency);
    }

    public static boolean isZeroAddress(String address) {
        return address == null || address.isBlank() || ZERO_ADDRESS.equalsIgnoreCase(address);
    }
}
