package uk.gov.di.oautherrors.shared.services;

import org.junit.jupiter.api.Test;
import uk.gov.di.oautherrors.shared.serialization.Json.JsonException;

import java.util.LinkedHashMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

class SerializationServiceTest {

    private final SerializationService objectMapper = SerializationService.getInstance();

    @Test
    void shouldWriteMapEntriesInInsertionOrder() throws JsonException {
        var payload = new LinkedHashMap<String, String>();
        payload.put("error", "invalid_client");
        payload.put("message", "Client authentication failed");

        assertThat(
                objectMapper.writeValueAsString(payload),
                equalTo("{\"error\":\"invalid_client\",\"message\":\"Client authentication failed\"}"));
    }
}
