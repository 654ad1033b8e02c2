package com.hostelbooking.inventory.domain.repository;

import com.hostelbooking.inventory.domain.model.CalendarFeed;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CalendarFeedRepository extends JpaRepository<CalendarFeed, Long> {

    List<CalendarFeed> findByActiveTrueOrderById();

    List<CalendarFeed> findByRoomIdAndActiveTrueOrderById(String roomId);
}
