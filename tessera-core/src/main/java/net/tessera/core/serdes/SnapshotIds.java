package net.tessera.core.serdes;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Content ids for immutable snapshots: SHA-1 of the canonical encoding. */
public final class SnapshotIds {
    private SnapshotIds() {}

    public static String create(Serdes serdes, Object value) {
        return sha1(serdes.serialize(value));
    }

    static String sha1(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        }
    }
}
