package io.github.chirino.tracker.store.impl;

import io.github.chirino.tracker.store.TrackerEventRepository;
import java.util.OptionalLong;
import org.jboss.logging.Logger;

/**
 * Moves conversations stored under an integer {@code sender_id} to the canonical string key.
 *
 * <p>Older writers stored purely numeric sender ids as numbers. The rewrite happens lazily, the
 * first time such a conversation is read under its string key and nothing is found.
 */
public class SenderIdNormalizer {

    private static final Logger LOG = Logger.getLogger(SenderIdNormalizer.class);

    private final TrackerEventRepository repository;

    public SenderIdNormalizer(TrackerEventRepository repository) {
        this.repository = repository;
    }

    /**
     * @return true when records were rewritten and a read under {@code senderId} is worth
     *     repeating
     */
    public boolean migrateLegacySenderId(String senderId) {
        OptionalLong legacyId = legacyNumericId(senderId);
        if (legacyId.isEmpty()) {
            return false;
        }
        long rewritten = repository.rewriteLegacySenderId(legacyId.getAsLong(), senderId);
        if (rewritten > 0) {
            LOG.infof(
                    "Rewrote %d records of legacy numeric sender id %d to '%s'",
                    rewritten, legacyId.getAsLong(), senderId);
        }
        return rewritten > 0;
    }

    static OptionalLong legacyNumericId(String senderId) {
        if (senderId == null || senderId.isEmpty()) {
            return OptionalLong.empty();
        }
        for (int i = 0; i < senderId.length(); i++) {
            char c = senderId.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalLong.empty();
            }
        }
        try {
            return OptionalLong.of(Long.parseLong(senderId));
        } catch (NumberFormatException e) {
            // more digits than a long holds, no writer could have stored it as a number
            return OptionalLong.empty();
        }
    }
}
