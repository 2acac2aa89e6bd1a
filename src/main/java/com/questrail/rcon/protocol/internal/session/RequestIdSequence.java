package com.questrail.rcon.protocol.internal.session;

import com.questrail.rcon.protocol.model.RconProtocol;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * RequestIdSequence
 * -----------------------------------------------------------------------------
 * Generator for command request ids in
 * {@code [RconProtocol.MIN_REQUEST_ID, RconProtocol.MAX_REQUEST_ID]}.
 *
 * <p>Ids advance monotonically and wrap. An id handed out stays reserved until
 * it is {@linkplain #release(int) released} or, for a request abandoned
 * without a reply, {@linkplain #quarantine(int) quarantined}. Quarantined ids
 * are withheld for the next {@code quarantineCapacity} abandonments so a late
 * reply to an abandoned request cannot be taken for a reply to a new one.</p>
 *
 * <p>Not thread-safe; guarded by the owning session.</p>
 */
final class RequestIdSequence
{
    static final int DEFAULT_QUARANTINE_CAPACITY = 32;

    private final int quarantineCapacity;
    private final Set<Integer> reserved = new HashSet<>();
    private final Deque<Integer> quarantined = new ArrayDeque<>();

    private int last = RconProtocol.MAX_REQUEST_ID;

    RequestIdSequence() {
        this(DEFAULT_QUARANTINE_CAPACITY);
    }

    RequestIdSequence(int quarantineCapacity) {
        int range = RconProtocol.MAX_REQUEST_ID - RconProtocol.MIN_REQUEST_ID + 1;
        if (quarantineCapacity < 0 || quarantineCapacity >= range) {
            throw new IllegalArgumentException("quarantineCapacity must be 0-" + (range - 1));
        }
        this.quarantineCapacity = quarantineCapacity;
    }

    /**
     * Reserve and return the next free id.
     *
     * @throws IllegalStateException if every id in the range is reserved
     */
    int next() {
        int range = RconProtocol.MAX_REQUEST_ID - RconProtocol.MIN_REQUEST_ID + 1;
        for (int i = 0; i < range; i++) {
            last = (last == RconProtocol.MAX_REQUEST_ID) ? RconProtocol.MIN_REQUEST_ID : last + 1;
            if (reserved.add(last)) {
                return last;
            }
        }
        throw new IllegalStateException("No free RCON request id");
    }

    /**
     * Return an id whose request completed normally.
     */
    void release(int id) {
        reserved.remove(id);
    }

    /**
     * Keep an abandoned id reserved for a while; releases the oldest
     * quarantined id once capacity is exceeded.
     */
    void quarantine(int id) {
        if (!reserved.contains(id)) {
            return;
        }
        quarantined.addLast(id);
        while (quarantined.size() > quarantineCapacity) {
            reserved.remove(quarantined.removeFirst());
        }
    }

    boolean isReserved(int id) {
        return reserved.contains(id);
    }
}
