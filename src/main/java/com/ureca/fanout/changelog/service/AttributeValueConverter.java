package com.ureca.fanout.changelog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.fanout.changelog.exception.ChangeRecordDecodeException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ureca.fanout.common.BaseCode.CHANGE_RECORD_UNSUPPORTED_ATTRIBUTE;

/**
 * 속성 인코딩된 이미지를 일반 값으로 변환
 * <p>
 * 속성 하나는 {"S": "..."} 처럼 타입 키 하나만 가진 객체
 * S, N, BOOL, NULL, M, L, SS, NS, B, BS 지원
 */
public class AttributeValueConverter {

    private static final int MAX_NUMBER_PRECISION = 38;
    private static final long MIN_NUMBER_EXPONENT = -130;
    private static final long MAX_NUMBER_EXPONENT = 125;

    /**
     * 이미지 전체 변환 (속성 순서 유지)
     *
     * @param image 속성 이름 -> 속성 값 디스크립터
     * @return 속성 이름 -> 변환된 값 (NULL 속성은 null)
     * @throws ChangeRecordDecodeException 형식이 잘못된 속성
     */
    public Map<String, Object> unmarshall(Map<String, JsonNode> image) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : image.entrySet()) {
            result.put(entry.getKey(), convert(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    public Object convert(String path, JsonNode attribute) {
        if (attribute == null || !attribute.isObject() || attribute.size() != 1) {
            throw new ChangeRecordDecodeException("속성 디스크립터 형식 오류. path: " + path);
        }

        Map.Entry<String, JsonNode> descriptor = attribute.fields().next();
        String type = descriptor.getKey();
        JsonNode value = descriptor.getValue();

        return switch (type) {
            case "S" -> requireText(path, value);
            case "N" -> toNumber(path, requireText(path, value));
            case "BOOL" -> toBoolean(path, value);
            case "NULL" -> null;
            case "M" -> toMap(path, value);
            case "L" -> toList(path, value);
            case "SS" -> toStringSet(path, value);
            case "NS" -> toNumberSet(path, value);
            case "B" -> toBinary(path, value);
            case "BS" -> toBinaryList(path, value);
            default -> throw new ChangeRecordDecodeException(CHANGE_RECORD_UNSUPPORTED_ATTRIBUTE,
                    "지원하지 않는 속성 타입: " + type + ", path: " + path);
        };
    }

    private Map<String, Object> toMap(String path, JsonNode value) {
        if (!value.isObject()) {
            throw new ChangeRecordDecodeException("M 속성은 객체여야 합니다. path: " + path);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), convert(path + "." + field.getKey(), field.getValue()));
        }
        return map;
    }

    private List<Object> toList(String path, JsonNode value) {
        requireArray(path, value);
        List<Object> list = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            list.add(convert(path + "[" + i + "]", value.get(i)));
        }
        return list;
    }

    private Set<String> toStringSet(String path, JsonNode value) {
        requireArray(path, value);
        Set<String> set = new LinkedHashSet<>();
        for (JsonNode element : value) {
            set.add(requireText(path, element));
        }
        return set;
    }

    private Set<Number> toNumberSet(String path, JsonNode value) {
        requireArray(path, value);
        Set<Number> set = new LinkedHashSet<>();
        for (JsonNode element : value) {
            set.add(toNumber(path, requireText(path, element)));
        }
        return set;
    }

    private List<byte[]> toBinaryList(String path, JsonNode value) {
        requireArray(path, value);
        List<byte[]> list = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            list.add(toBinary(path, element));
        }
        return list;
    }

    private byte[] toBinary(String path, JsonNode value) {
        requireText(path, value);
        try {
            return value.binaryValue();
        } catch (IOException e) {
            throw new ChangeRecordDecodeException("B 속성 base64 해석 실패. path: " + path, e);
        }
    }

    // 정수는 Long (범위 초과 시 BigInteger), 소수는 BigDecimal
    private Number toNumber(String path, String text) {
        try {
            BigDecimal number = new BigDecimal(text);
            requireNumberRange(path, number);
            if (number.scale() > 0) {
                return number;
            }
            try {
                return number.longValueExact();
            } catch (ArithmeticException e) {
                return number.toBigIntegerExact();
            }
        } catch (NumberFormatException e) {
            throw new ChangeRecordDecodeException("N 속성 숫자 해석 실패. path: " + path + ", value: " + text, e);
        }
    }

    // 유효 숫자 38자리, 10^-130 ~ 10^126 미만 (지수가 큰 값을 정수로 펼치지 않도록 먼저 검사)
    private void requireNumberRange(String path, BigDecimal number) {
        if (number.signum() == 0) {
            return;
        }
        BigDecimal normalized = number.stripTrailingZeros();
        long exponent = (long) normalized.precision() - normalized.scale() - 1;
        if (normalized.precision() > MAX_NUMBER_PRECISION
                || exponent < MIN_NUMBER_EXPONENT || exponent > MAX_NUMBER_EXPONENT) {
            throw new ChangeRecordDecodeException("N 속성 범위 초과. path: " + path
                    + ", precision: " + normalized.precision() + ", exponent: " + exponent);
        }
    }

    private Boolean toBoolean(String path, JsonNode value) {
        if (!value.isBoolean()) {
            throw new ChangeRecordDecodeException("BOOL 속성은 boolean 이어야 합니다. path: " + path);
        }
        return value.booleanValue();
    }

    private String requireText(String path, JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new ChangeRecordDecodeException("문자열 값이 필요합니다. path: " + path);
        }
        return value.textValue();
    }

    private void requireArray(String path, JsonNode value) {
        if (!value.isArray()) {
            throw new ChangeRecordDecodeException("배열 값이 필요합니다. path: " + path);
        }
    }
}
