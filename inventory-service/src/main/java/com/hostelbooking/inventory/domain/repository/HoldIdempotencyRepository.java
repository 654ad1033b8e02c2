package com.hostelbooking.inventory.domain.repository;

import com.hostelbooking.inventory.domain.model.HoldIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HoldIdempotencyRepository extends JpaRepository<HoldIdempotency, String> {
}
