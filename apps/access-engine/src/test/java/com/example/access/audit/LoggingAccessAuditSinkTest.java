package com.example.access.audit;

import com.example.access.gate.model.AccessRequest;
import com.example.access.gate.model.AuthorizationDecision;
import com.example.access.gate.model.DecisionRule;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.Map;

import static com.example.access.privilege.catalog.StandardPrivileges.VIEW_SCOUT_PROFILES;
import static com.example.access.util.AuthenticationContextTestBuilder.NOW;
import static com.example.access.util.AuthenticationContextTestBuilder.aContextFor;
import static com.example.access.util.RosterTestBuilder.standardTroop;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("LoggingAccessAuditSink")
class LoggingAccessAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static AccessAuditEvent bypass() {
        AccessRequest request = new AccessRequest(VIEW_SCOUT_PROFILES, UnitRole.MEMBER, "scout-003", List.of(),
                standardTroop());
        return AccessAuditEvent.forDecision(NOW, aContextFor("admin-001", UnitRole.COUNCIL_ADMIN), UnitRole.COUNCIL_ADMIN,
                request, AuthorizationDecision.allowed(DecisionRule.ADMINISTRATOR_BYPASS, VIEW_SCOUT_PROFILES, Scope.TROOP),
                Scope.TROOP);
    }

    @Test
    @DisplayName("should flatten the event into snake_case fields")
    void shouldFlattenEvent() throws Exception {
        AccessAuditEvent event = bypass();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event.toStructuredLog()));

        assertThat(json.get("event_type").asText()).isEqualTo("access_decision");
        assertThat(json.get("event_id").asText()).isEqualTo(event.eventId());
        assertThat(json.get("action").asText()).isEqualTo("bypass");
        assertThat(json.get("actor_id").asText()).isEqualTo("admin-001");
        assertThat(json.get("actor_role").asText()).isEqualTo("council_admin");
        assertThat(json.get("actual_level").asInt()).isEqualTo(3);
        assertThat(json.get("actual_scope").asText()).isEqualTo("T");
        assertThat(json.get("target_owner_id").asText()).isEqualTo("scout-003");
        assertThat(json.get("rule").asText()).isEqualTo("ADMINISTRATOR_BYPASS");
        assertThat(json.get("reason").asText()).isEmpty();
    }

    @Test
    @DisplayName("should write the event as one JSON line")
    void shouldWriteJson(CapturedOutput output) {
        AccessAuditEvent event = bypass();

        new LoggingAccessAuditSink(objectMapper).publish(event);

        assertThat(output).contains("\"event_id\":\"" + event.eventId() + "\"");
        assertThat(output).contains("\"rule\":\"ADMINISTRATOR_BYPASS\"");
    }

    @Test
    @DisplayName("should fall back to key=value output when serialization fails")
    void shouldFallBackOnSerializationFailure(CapturedOutput output) throws Exception {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any(Map.class))).thenThrow(new JsonProcessingException("boom") {});

        new LoggingAccessAuditSink(failing).publish(bypass());

        assertThat(output).contains("Failed to serialize audit event");
        assertThat(output).contains("actor=admin-001");
        assertThat(output).contains("rule=ADMINISTRATOR_BYPASS");
    }
}
