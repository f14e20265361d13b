package com.ureca.fanout.changelog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.ureca.fanout.changelog.entity.ChangeRecord;
import com.ureca.fanout.changelog.entity.MutationKind;

import java.util.Map;

/**
 * 변경 로그 큐 메시지 본문 (스트림 레코드 JSON 형태)
 * <pre>
 * {"eventID": "...", "eventName": "INSERT", "dynamodb": {"NewImage": {...}}}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamRecordMessage(
        @JsonProperty("eventID") String eventId,
        @JsonProperty("eventName") String eventName,
        @JsonProperty("dynamodb") StreamRecordImages dynamodb
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StreamRecordImages(
            @JsonProperty("NewImage") Map<String, JsonNode> newImage
    ) {
    }

    public ChangeRecord toChangeRecord() {
        Map<String, JsonNode> image = dynamodb == null ? null : dynamodb.newImage();
        return new ChangeRecord(eventId, MutationKind.from(eventName), image);
    }
}
