package com.tutorhub.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.event.domain.OutboxEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, UUID> {

    List<OutboxEvent> findByAggregateIdOrderByOccurredAtAsc(UUID aggregateId);
}
