package com.appointments.booking.web;

import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.exception.BookingValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a JSON object or a form body into a flat string map.
 * JSON members must be scalars; nested objects and arrays are rejected.
 */
@Component
@RequiredArgsConstructor
public class RequestBodyReader {

    private final ObjectMapper objectMapper;

    public Map<String, String> read(HttpServletRequest request) throws IOException {
        if (isJson(request.getContentType())) {
            return readJson(request);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                fields.put(name, values[0]);
            }
        });
        return fields;
    }

    private Map<String, String> readJson(HttpServletRequest request) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(request.getInputStream());
        } catch (JsonProcessingException e) {
            throw new BookingValidationException("INVALID_BODY", ValidationMessages.INVALID_BODY);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return fields;
        }
        if (!root.isObject()) {
            throw new BookingValidationException("INVALID_BODY", ValidationMessages.INVALID_BODY);
        }

        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            if (!value.isValueNode()) {
                throw new BookingValidationException("INVALID_BODY", ValidationMessages.INVALID_BODY,
                        Map.of(field.getKey(), "expected a single value"));
            }
            fields.put(field.getKey(), value.asText());
        }
        return fields;
    }

    private static boolean isJson(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }
}
