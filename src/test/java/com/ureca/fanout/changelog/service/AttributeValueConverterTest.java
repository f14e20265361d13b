package com.ureca.fanout.changelog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ureca.fanout.changelog.exception.ChangeRecordDecodeException;
import com.ureca.fanout.common.BaseCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * - 속성 타입별 변환
 * - 중첩 M / L 재귀 변환
 * - 형식 오류 -> ChangeRecordDecodeException
 */
class AttributeValueConverterTest {

    private final AttributeValueConverter converter = new AttributeValueConverter();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("정상 : 이벤트 이미지 변환 (S, N, BOOL, NULL)")
    void unmarshall_Scalars() throws Exception {
        // given
        Map<String, JsonNode> image = image("""
                {
                  "event": {"S": "NOTE_ADDED"},
                  "count": {"N": "42"},
                  "ratio": {"N": "0.25"},
                  "huge": {"N": "123456789012345678901234567890"},
                  "active": {"BOOL": true},
                  "deletedAt": {"NULL": true}
                }
                """);

        // when
        Map<String, Object> result = converter.unmarshall(image);

        // then
        assertThat(result.get("event")).isEqualTo("NOTE_ADDED");
        assertThat(result.get("count")).isEqualTo(42L);
        assertThat(result.get("ratio")).isEqualTo(new BigDecimal("0.25"));
        assertThat(result.get("huge")).isEqualTo(new BigInteger("123456789012345678901234567890"));
        assertThat(result.get("active")).isEqualTo(true);
        assertThat(result).containsKey("deletedAt");
        assertThat(result.get("deletedAt")).isNull();
    }

    @Test
    @DisplayName("정상 : 중첩 M, L 과 집합 타입 변환")
    void unmarshall_Nested() throws Exception {
        // given
        Map<String, JsonNode> image = image("""
                {
                  "payload": {"M": {
                    "id": {"N": "1"},
                    "tags": {"L": [{"S": "a"}, {"N": "2"}]},
                    "author": {"M": {"name": {"S": "kim"}}}
                  }},
                  "labels": {"SS": ["x", "y"]},
                  "scores": {"NS": ["1", "2.5"]},
                  "raw": {"B": "aGVsbG8="}
                }
                """);

        // when
        Map<String, Object> result = converter.unmarshall(image);

        // then
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) result.get("payload");
        assertThat(payload.get("id")).isEqualTo(1L);
        assertThat(payload.get("tags")).isEqualTo(List.of("a", 2L));
        assertThat(payload.get("author")).isEqualTo(Map.of("name", "kim"));

        assertThat((Iterable<Object>) result.get("labels")).containsExactly("x", "y");
        assertThat((Iterable<Object>) result.get("scores")).containsExactly(1L, new BigDecimal("2.5"));
        assertThat(new String((byte[]) result.get("raw"), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    @DisplayName("예외 : 지원하지 않는 타입 -> UNSUPPORTED_ATTRIBUTE 코드")
    void convert_UnsupportedType() throws Exception {
        // given
        JsonNode attribute = objectMapper.readTree("{\"X\": \"?\"}");

        // when, then
        assertThatThrownBy(() -> converter.convert("event", attribute))
                .isInstanceOf(ChangeRecordDecodeException.class)
                .extracting("baseCode")
                .isEqualTo(BaseCode.CHANGE_RECORD_UNSUPPORTED_ATTRIBUTE);
    }

    @Test
    @DisplayName("예외 : 디스크립터 형식 오류 (키 2개, 객체 아님, 숫자 아님)")
    void convert_Malformed() throws Exception {
        // given
        String[] malformed = {
                "{\"S\": \"a\", \"N\": \"1\"}",
                "\"plain\"",
                "{}",
                "{\"N\": \"not-a-number\"}",
                "{\"S\": 1}",
                "{\"BOOL\": \"true\"}",
                "{\"L\": {\"S\": \"a\"}}"
        };

        // when, then
        for (String json : malformed) {
            JsonNode attribute = objectMapper.readTree(json);
            assertThatThrownBy(() -> converter.convert("payload", attribute))
                    .as(json)
                    .isInstanceOf(ChangeRecordDecodeException.class);
        }
    }

    @Test
    @DisplayName("예외 : 저장소 숫자 범위를 벗어난 N -> 정수로 펼치지 않고 즉시 거부")
    void convert_NumberOutOfRange() throws Exception {
        // given
        String[] outOfRange = {
                "1E+30000000",
                "-1E+126",
                "1E-131",
                "1234567890123456789012345678901234567890"
        };

        // when, then
        for (String number : outOfRange) {
            JsonNode attribute = objectMapper.readTree("{\"N\": \"" + number + "\"}");
            assertTimeoutPreemptively(Duration.ofSeconds(1), () ->
                    assertThatThrownBy(() -> converter.convert("payload.id", attribute))
                            .as(number)
                            .isInstanceOf(ChangeRecordDecodeException.class)
                            .hasMessageContaining("범위 초과"));
        }
    }

    @Test
    @DisplayName("경계 : 범위 안의 큰 지수, 작은 소수, 0 은 정상 변환")
    void convert_NumberWithinRange() throws Exception {
        // given
        JsonNode bigExponent = objectMapper.readTree("{\"N\": \"9.9E+125\"}");
        JsonNode smallFraction = objectMapper.readTree("{\"N\": \"1E-130\"}");
        JsonNode zero = objectMapper.readTree("{\"N\": \"0E+999\"}");

        // when, then
        assertThat(converter.convert("a", bigExponent)).isEqualTo(new BigDecimal("9.9E+125").toBigIntegerExact());
        assertThat(converter.convert("b", smallFraction)).isEqualTo(new BigDecimal("1E-130"));
        assertThat(converter.convert("c", zero)).isEqualTo(0L);
    }

    private Map<String, JsonNode> image(String json) throws Exception {
        return objectMapper.readValue(json,
                objectMapper.getTypeFactory().constructMapType(Map.class, String.class, JsonNode.class));
    }
}
