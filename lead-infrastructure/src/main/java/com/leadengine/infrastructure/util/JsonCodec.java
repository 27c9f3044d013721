package com.leadengine.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadengine.types.enums.ResponseCode;
import com.leadengine.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSONB 列的编解码。空串与 null 读出为空集合。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<Map<String, Boolean>> FLAG_MAP_REF = new TypeReference<Map<String, Boolean>>() {};
    private static final TypeReference<List<String>> STRING_LIST_REF = new TypeReference<List<String>>() {};
    private static final TypeReference<List<Long>> LONG_LIST_REF = new TypeReference<List<Long>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        Map<String, Object> value = readValue(json, MAP_REF);
        return value == null ? new HashMap<>() : value;
    }

    public Map<String, Boolean> readFlagMap(String json) {
        Map<String, Boolean> value = readValue(json, FLAG_MAP_REF);
        return value == null ? new HashMap<>() : value;
    }

    public List<String> readStringList(String json) {
        List<String> value = readValue(json, STRING_LIST_REF);
        return value == null ? new ArrayList<>() : value;
    }

    public Set<String> readStringSet(String json) {
        return new LinkedHashSet<>(readStringList(json));
    }

    public Set<Long> readLongSet(String json) {
        List<Long> value = readValue(json, LONG_LIST_REF);
        return value == null ? new LinkedHashSet<>() : new LinkedHashSet<>(value);
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
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

    /**
     * 集合写为 JSON 数组，null 写为空数组
     */
    public String writeArray(Collection<?> values) {
        return writeValue(values == null ? List.of() : values);
    }
}
