package com.appointments.booking.web;

import com.appointments.booking.exception.BookingValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RequestBodyReader Unit Tests")
class RequestBodyReaderTest {

    private final RequestBodyReader reader = new RequestBodyReader(new ObjectMapper());

    private static MockHttpServletRequest json(String body) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/bookings/update");
        request.setContentType(MediaType.APPLICATION_JSON_VALUE + ";charset=UTF-8");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        return request;
    }

    @Test
    @DisplayName("Should flatten a JSON object into strings")
    void read_JsonObject_Flattened() throws Exception {
        Map<String, String> fields = reader.read(json("{\"id\": 4, \"attended\": true, \"note\": null, \"nome\": \"Anna\"}"));

        assertThat(fields)
                .containsEntry("id", "4")
                .containsEntry("attended", "true")
                .containsEntry("nome", "Anna")
                .doesNotContainKey("note");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void read_MalformedJson_Throws() {
        assertThatThrownBy(() -> reader.read(json("{\"id\": ")))
                .isInstanceOf(BookingValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_BODY");
    }

    @Test
    @DisplayName("Should reject JSON that is not an object")
    void read_JsonArray_Throws() {
        assertThatThrownBy(() -> reader.read(json("[1, 2]")))
                .isInstanceOf(BookingValidationException.class);
    }

    @Test
    @DisplayName("Should reject arrays and objects as field values")
    void read_NonScalarValue_Throws() {
        assertThatThrownBy(() -> reader.read(json("{\"nome\": [\"a\"]}")))
                .isInstanceOf(BookingValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_BODY")
                .satisfies(ex -> assertThat(((BookingValidationException) ex).getDetails()).containsKey("nome"));
        assertThatThrownBy(() -> reader.read(json("{\"id\": {\"value\": 4}}")))
                .isInstanceOf(BookingValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_BODY");
    }

    @Test
    @DisplayName("Should treat an empty JSON body as no fields")
    void read_EmptyJson_Empty() throws Exception {
        assertThat(reader.read(json(""))).isEmpty();
    }

    @Test
    @DisplayName("Should read form fields keeping the first value")
    void read_Form_FirstValue() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/prenota");
        request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        request.addParameter("nome", "Anna", "Ignored");
        request.addParameter("privacy", "on");

        assertThat(reader.read(request))
                .containsEntry("nome", "Anna")
                .containsEntry("privacy", "on");
    }
}
