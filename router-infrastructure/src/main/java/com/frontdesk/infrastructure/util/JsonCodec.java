package com.frontdesk.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontdesk.types.enums.ResponseCode;
import com.frontdesk.types.exception.AppException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * JSON 编解码工具，解析失败统一转换为 {@link AppException}。
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取整个输入流为 JSON 树；source 只用于错误信息。
     */
    public JsonNode readTree(InputStream input, String source) {
        try {
            return objectMapper.readTree(input);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.SCENARIO_SOURCE_ERROR,
                    "Failed to parse json from " + source + ": " + ex.getMessage(), ex);
        }
    }

    public <T> T treeToValue(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new AppException(ResponseCode.SCENARIO_SOURCE_ERROR, "Failed to bind json: " + ex.getMessage(), ex);
        }
    }

    public Map<String, Object> toMap(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, MAP_REF);
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}
