package org.carball.aql.model.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingPropertiesTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void shouldReproduceWireNamesAfterNormalizing() throws Exception {
        // Given
        JsonNode wire = objectMapper.readTree("""
            {"enabled": true, "maxSlowQueries": 64, "slowQueryThreshold": 10.5,
             "maxQueryStringLength": 4096, "trackBindVars": false, "trackSlowQueries": true}
            """);

        // When
        TrackingProperties normalized = objectMapper.treeToValue(wire, TrackingProperties.class);
        JsonNode denormalized = objectMapper.valueToTree(normalized);

        // Then
        assertThat(denormalized).isEqualTo(wire);
    }

    @Test
    void shouldIgnoreTransportFields() throws Exception {
        // When
        TrackingProperties properties = objectMapper.readValue(
                "{\"error\": false, \"code\": 200, \"enabled\": false}", TrackingProperties.class);

        // Then
        assertThat(properties.getEnabled()).isFalse();
        assertThat(objectMapper.valueToTree(properties).toString()).isEqualTo("{\"enabled\":false}");
    }
}
