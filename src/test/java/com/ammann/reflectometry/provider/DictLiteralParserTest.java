/* (C)2026 */
package com.ammann.reflectometry.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.reflectometry.exception.MetadataReadException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

class DictLiteralParserTest {

    @Test
    void parsesNestedDictionaryWithNumericKeys() {
        JsonNode node = DictLiteralParser.parse("{1: {'name': 'S1', 'length': 20.0, 'flag': True, 'note': None}}");

        JsonNode sample = node.get("1");
        assertThat(DictLiteralParser.text(sample, "name")).isEqualTo("S1");
        assertThat(DictLiteralParser.number(sample, "length", 0)).isEqualTo(20.0);
        assertThat(sample.get("flag").asBoolean()).isTrue();
        assertThat(DictLiteralParser.text(sample, "note")).isNull();
    }

    @Test
    void outerTupleBecomesList() {
        JsonNode node = DictLiteralParser.parse("({'name': 'A (left)'}, {'name': 'B'})");

        assertThat(node.isArray()).isTrue();
        assertThat(node.size()).isEqualTo(2);
        assertThat(DictLiteralParser.text(node.get(0), "name")).isEqualTo("A (left)");
    }

    @Test
    void numberFallsBackForMissingOrTextValues() {
        JsonNode node = DictLiteralParser.parse("{'length': 'n/a', 'height': '12.5'}");

        assertThat(DictLiteralParser.number(node, "length", -1)).isEqualTo(-1);
        assertThat(DictLiteralParser.number(node, "height", -1)).isEqualTo(12.5);
        assertThat(DictLiteralParser.number(node, "width", 3)).isEqualTo(3);
    }

    @Test
    void malformedLiteralIsReported() {
        assertThatThrownBy(() -> DictLiteralParser.parse("{'name': "))
                .isInstanceOf(MetadataReadException.class);
    }
}
