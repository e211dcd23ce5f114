package com.appointments.booking.web;

import com.appointments.booking.constants.BookingConstants;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Base URL placed in emailed links. A configured value wins over the request's Host header.
 */
@Component
public class PublicUrlResolver {

    private final String configuredBaseUrl;

    public PublicUrlResolver(@Value("${booking.public-base-url:}") String configuredBaseUrl) {
        this.configuredBaseUrl = configuredBaseUrl;
    }

    public String baseUrl(HttpServletRequest request) {
        if (StringUtils.hasText(configuredBaseUrl)) {
            return StringUtils.trimTrailingCharacter(configuredBaseUrl.trim(), '/');
        }
        String host = request.getHeader(HttpHeaders.HOST);
        return "http://" + (StringUtils.hasText(host) ? host.trim() : BookingConstants.DEFAULT_HOST);
    }
}
