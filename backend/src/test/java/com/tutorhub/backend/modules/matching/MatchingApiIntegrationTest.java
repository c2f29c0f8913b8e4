package com.tutorhub.backend.modules.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.tutorhub.backend.modules.event.domain.OutboxEvent;
import com.tutorhub.backend.modules.event.infrastructure.persistence.OutboxEventRepository;
import com.tutorhub.backend.support.AbstractApiIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class MatchingApiIntegrationTest extends AbstractApiIntegrationTest {

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Test
    void studentIsMatchedWithApprovedTutor() throws Exception {
        UUID tutorId = createApprovedTutor("35.00");
        UUID studentId = createUser("STUDENT", true);

        JsonNode request = postJson("/matching-requests", Map.of(
                "studentId", studentId.toString(),
                "subject", "MATHEMATICS",
                "maxHourlyRate", 40,
                "preferredLanguages", List.of("English")
        ), 201);
        UUID requestId = UUID.fromString(request.get("id").asText());
        assertThat(request.get("status").asText()).isEqualTo("PENDING");

        JsonNode matched = postJson("/matching-requests/" + requestId + "/match",
                Map.of("tutorId", tutorId.toString()), 200);

        assertThat(matched.get("status").asText()).isEqualTo("MATCHED");
        assertThat(matched.get("matchedTutorId").asText()).isEqualTo(tutorId.toString());
        List<OutboxEvent> events = outboxEventRepository.findByAggregateIdOrderByOccurredAtAsc(requestId);
        assertThat(events).extracting(OutboxEvent::getEventType)
                .containsExactlyInAnyOrder("matching_request.created", "matching_request.status_changed");
    }

    @Test
    @DisplayName("정지된 튜터와의 매칭은 409로 거절되고 요청은 PENDING으로 남는다")
    void suspendedTutorIsRejected() throws Exception {
        UUID tutorId = createApprovedTutor("20.00");
        patchJson("/tutors/" + tutorId + "/status", Map.of("status", "SUSPENDED", "reason", "complaints"), 200);
        UUID studentId = createUser("STUDENT", true);
        UUID requestId = openRequest(studentId);

        JsonNode problem = postJson("/matching-requests/" + requestId + "/match",
                Map.of("tutorId", tutorId.toString()), 409);

        assertThat(problem.get("code").asText()).isEqualTo("TUTOR_NOT_ACTIVE");
        mockMvc.perform(get("/matching-requests/" + requestId))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void cancelledRequestCannotBeEdited() throws Exception {
        UUID studentId = createUser("STUDENT", true);
        UUID requestId = openRequest(studentId);

        JsonNode cancelled = postJson("/matching-requests/" + requestId + "/cancel",
                Map.of("reason", "no longer needed"), 200);
        assertThat(cancelled.get("cancellationReason").asText()).isEqualTo("no longer needed");

        JsonNode problem = patchJson("/matching-requests/" + requestId, Map.of("description", "again"), 409);
        assertThat(problem.get("code").asText()).isEqualTo("invalid_state");
    }

    @Test
    void inactiveStudentCannotOpenRequests() throws Exception {
        UUID pendingStudent = createUser("STUDENT", false);

        JsonNode problem = postJson("/matching-requests", Map.of(
                "studentId", pendingStudent.toString(),
                "subject", "BIOLOGY"
        ), 409);

        assertThat(problem.get("code").asText()).isEqualTo("STUDENT_NOT_ACTIVE");
    }

    @Test
    void listFiltersByStudent() throws Exception {
        UUID studentId = createUser("STUDENT", true);
        openRequest(studentId);
        openRequest(studentId);
        openRequest(createUser("STUDENT", true));

        mockMvc.perform(get("/matching-requests").param("studentId", studentId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.items[0].studentId").value(studentId.toString()));
    }

    @Test
    void missingTutorIdFailsBeanValidation() throws Exception {
        UUID requestId = openRequest(createUser("STUDENT", true));

        JsonNode problem = postJson("/matching-requests/" + requestId + "/match", Map.of(), 422);

        assertThat(problem.get("violations").findValuesAsText("field")).contains("tutorId");
    }

    private UUID openRequest(UUID studentId) throws Exception {
        JsonNode request = postJson("/matching-requests", Map.of(
                "studentId", studentId.toString(),
                "subject", "MATHEMATICS"
        ), 201);
        return UUID.fromString(request.get("id").asText());
    }

    private UUID createApprovedTutor(String hourlyRate) throws Exception {
        UUID ownerId = createUser("TUTOR", true);
        JsonNode tutor = postJson("/tutors", Map.of(
                "userId", ownerId.toString(),
                "bio", "Algebra and calculus",
                "subjects", List.of("MATHEMATICS"),
                "experienceLevel", "ADVANCED",
                "hourlyRate", hourlyRate,
                "languages", List.of("English"),
                "education", "MSc Mathematics"
        ), 201);
        UUID tutorId = UUID.fromString(tutor.get("id").asText());
        patchJson("/tutors/" + tutorId + "/status", Map.of("status", "ACTIVE"), 200);
        return tutorId;
    }
}
