package com.tutorhub.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.event.domain.DeadLetterEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DeadLetterEventRepository extends JpaRepository<DeadLetterEvent, UUID> {

    List<DeadLetterEvent> findByAggregateId(UUID aggregateId);
}
