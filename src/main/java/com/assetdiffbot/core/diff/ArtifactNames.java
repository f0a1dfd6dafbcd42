package com.assetdiffbot.core.diff;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable artifact names. The same inputs always give the same name, so re-running a job
 * overwrites its own files instead of producing new ones.
 */
public final class ArtifactNames {

    private ArtifactNames() {}

    /**
     * SHA-256 hex digest of raw file content.
     */
    public static String contentHash(byte[] content) {
        return HexFormat.of().formatHex(sha256().digest(content));
    }

    /**
     * Name of one rendered sprite state.
     *
     * @param sourceSha      commit the sheet was read from
     * @param file           repository path of the sheet
     * @param contentHash    {@link #contentHash} of the sheet bytes
     * @param duplicateIndex index among states sharing the name
     * @param stateName      state name
     */
    public static String spriteState(String sourceSha, String file, String contentHash,
                                     int duplicateIndex, String stateName) {
        var digest = sha256();
        // Length-prefix each part so that ("ab", "c") and ("a", "bc") differ
        for (String part : new String[]{sourceSha, file, contentHash, Integer.toString(duplicateIndex), stateName}) {
            byte[] bytes = (part == null ? "" : part).getBytes(StandardCharsets.UTF_8);
            digest.update(Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII));
            digest.update((byte) ':');
            digest.update(bytes);
        }
        return HexFormat.of().formatHex(digest.digest()).substring(0, 32);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
