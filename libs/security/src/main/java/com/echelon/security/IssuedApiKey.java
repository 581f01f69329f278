package com.echelon.security;

/**
 * A freshly generated API key.
 * <p>
 * WHY a separate record: the raw key exists only in this value and is shown to the caller
 * exactly once. Only {@code prefix} and {@code hash} are ever persisted.
 *
 * @param rawKey the full secret, returned once
 * @param prefix lookup prefix stored alongside the hash
 * @param hash   one-way hash of {@code rawKey}
 */
public record IssuedApiKey(String rawKey, String prefix, String hash) {

    @Override
    public String toString() {
        return "IssuedApiKey[prefix=" + prefix + "]";
    }
}
