package com.tutorhub.backend.modules.event.infrastructure.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.modules.event.domain.PublishException;

import org.springframework.stereotype.Component;

@Component
public class EventPayloadSerializer {

    private final ObjectMapper objectMapper;

    public EventPayloadSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event.payload());
        } catch (JsonProcessingException ex) {
            throw new PublishException("Event payload is not serializable: " + event.eventType(), ex);
        }
    }
}
