package com.hostelbooking.inventory.domain.room;

import com.hostelbooking.common.exception.ResourceNotFoundException;
import com.hostelbooking.inventory.domain.model.Room;
import com.hostelbooking.inventory.domain.repository.RoomRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rooms are static reference data, so they are read once at startup and served from memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomCatalog {

    private final RoomRepository roomRepository;

    private volatile Map<String, Room> rooms = Collections.emptyMap();

    @PostConstruct
    public void load() {
        Map<String, Room> loaded = new LinkedHashMap<>();
        roomRepository.findAll().stream()
                .sorted(Comparator.comparing(Room::getName))
                .forEach(room -> loaded.put(room.getId(), room));
        this.rooms = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} room(s): {}", rooms.size(), rooms.keySet());
    }

    public Room get(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new ResourceNotFoundException("Room", roomId);
        }
        return room;
    }

    public Collection<Room> all() {
        return rooms.values();
    }
}
