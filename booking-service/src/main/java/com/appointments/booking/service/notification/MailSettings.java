package com.appointments.booking.service.notification;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Getter
@Component
public class MailSettings {

    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String from;
    private final String notify;
    private final int timeoutMs;

    public MailSettings(
            @Value("${booking.mail.host:}") String host,
            @Value("${booking.mail.port:587}") int port,
            @Value("${booking.mail.username:}") String username,
            @Value("${booking.mail.password:}") String password,
            @Value("${booking.mail.from:}") String from,
            @Value("${booking.mail.notify:}") String notify,
            @Value("${booking.mail.timeout-ms:10000}") int timeoutMs) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.from = StringUtils.hasText(from) ? from : username;
        this.notify = notify;
        this.timeoutMs = timeoutMs;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(host)
                && StringUtils.hasText(username)
                && StringUtils.hasText(password)
                && StringUtils.hasText(from);
    }

    public boolean hasNotifyAddress() {
        return StringUtils.hasText(notify);
    }
}
