package org.neuralchilli.decision.util;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.UUID;

/**
 * Queue task ids: URL-safe base64 encoding of a random UUID, without padding (22 chars).
 */
public final class SlugId {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private SlugId() {
    }

    /**
     * Random slug whose first character is a letter, so ids never look like
     * command line options.
     */
    public static String nice() {
        UUID uuid = UUID.randomUUID();
        long most = uuid.getMostSignificantBits() & 0x7fffffffffffffffL;
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(most);
        buffer.putLong(uuid.getLeastSignificantBits());
        return ENCODER.encodeToString(buffer.array());
    }
}
