package com.example.fulfillment.unit.infrastructure;

import com.example.fulfillment.infrastructure.persistence.converter.MetadataJsonConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

@DisplayName("MetadataJsonConverter Tests")
class MetadataJsonConverterTest {

    private final MetadataJsonConverter converter = new MetadataJsonConverter();

    @Test
    @DisplayName("should_keep_discount_scale_through_json_column")
    void should_keep_discount_scale_through_json_column() {
        // Given
        Map<String, Object> redemption = new LinkedHashMap<>();
        redemption.put("points_redeemed", 250);
        redemption.put("discount", new BigDecimal("2.50"));

        // When
        String json = converter.convertToDatabaseColumn(Map.of("loyalty_redemption", redemption));
        Map<String, Object> restored = converter.convertToEntityAttribute(json);

        // Then
        assertThat(json).contains("\"discount\":2.50");
        assertThat(restored.get("loyalty_redemption"))
                .asInstanceOf(MAP)
                .containsEntry("points_redeemed", 250)
                .containsEntry("discount", new BigDecimal("2.50"));
    }

    @Test
    @DisplayName("should_store_empty_metadata_as_empty_object")
    void should_store_empty_metadata_as_empty_object() {
        assertThat(converter.convertToDatabaseColumn(Map.of())).isEqualTo("{}");
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("{}");
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
    }

    @Test
    @DisplayName("should_reject_corrupt_column_value")
    void should_reject_corrupt_column_value() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("deserialize");
    }
}
