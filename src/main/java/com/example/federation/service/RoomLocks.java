package com.example.federation.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-room advisory locks. Membership writes hold the room's lock across
 * persisting the member event and updating the projection.
 * <p>
 * A room's lock lives only while some thread holds or waits for it.
 */
@Component
public class RoomLocks {

    private final ConcurrentHashMap<String, RoomLock> locks = new ConcurrentHashMap<>();

    public <T> T withRoomLock(String roomId, Supplier<T> action) {
        RoomLock roomLock = locks.compute(roomId, (k, existing) -> {
            RoomLock held = existing != null ? existing : new RoomLock();
            held.users++;
            return held;
        });
        roomLock.lock.lock();
        try {
            return action.get();
        } finally {
            roomLock.lock.unlock();
            locks.compute(roomId, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    int activeRooms() {
        return locks.size();
    }

    // users is only touched inside ConcurrentHashMap.compute for the room's key
    private static final class RoomLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
