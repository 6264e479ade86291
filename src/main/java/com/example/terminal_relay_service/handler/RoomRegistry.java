package com.example.terminal_relay_service.handler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RoomRegistry<K> {

    private final Map<K, Set<RelayConnection>> rooms = new LinkedHashMap<>();

    public void join(K key, RelayConnection connection) {
        rooms.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(connection);
    }

    public boolean leave(K key, RelayConnection connection) {
        Set<RelayConnection> room = rooms.get(key);
        if (room == null) {
            return false;
        }
        boolean removed = room.remove(connection);
        if (room.isEmpty()) {
            rooms.remove(key);
        }
        return removed;
    }

    public List<RelayConnection> members(K key) {
        Set<RelayConnection> room = rooms.get(key);
        return room == null ? List.of() : new ArrayList<>(room);
    }

    public boolean hasRoom(K key) {
        return rooms.containsKey(key);
    }

    public int roomCount() {
        return rooms.size();
    }

    public int connectionCount() {
        return rooms.values().stream().mapToInt(Set::size).sum();
    }

    public void clear() {
        rooms.clear();
    }
}
