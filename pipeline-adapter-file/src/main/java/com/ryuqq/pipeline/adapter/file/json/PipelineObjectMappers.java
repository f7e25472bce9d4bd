package com.ryuqq.pipeline.adapter.file.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 파일 어댑터 공용 ObjectMapper 구성.
 *
 * <p><strong>JSON 규칙:</strong></p>
 * <ul>
 *   <li>snake_case 프로퍼티 이름</li>
 *   <li>시간은 ISO-8601 문자열</li>
 *   <li>필드 기반 직렬화 (getter/setter 미사용)</li>
 *   <li>알 수 없는 프로퍼티는 무시</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class PipelineObjectMappers {

    private PipelineObjectMappers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태/체크포인트 파일용 (pretty print).
     */
    public static ObjectMapper json() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .visibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .visibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .visibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE)
            .disable(MapperFeature.USE_GETTERS_AS_SETTERS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    /**
     * JSONL 파일용 (한 줄에 한 객체).
     */
    public static ObjectMapper jsonLines() {
        return json().disable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 설정 파일용 YAML 매퍼.
     */
    public static ObjectMapper yaml() {
        return YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
