package com.appointments.booking.config;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.service.notification.MailSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

@Configuration
public class MailConfiguration {

    /**
     * Authenticated SMTP with implicit TLS on port 465 and mandatory STARTTLS on any other port.
     */
    @Bean
    public JavaMailSender javaMailSender(MailSettings settings) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(settings.getHost());
        sender.setPort(settings.getPort());
        sender.setUsername(settings.getUsername());
        sender.setPassword(settings.getPassword());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

        String timeout = String.valueOf(settings.getTimeoutMs());
        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);

        if (settings.getPort() == BookingConstants.IMPLICIT_TLS_PORT) {
            sender.setProtocol("smtps");
            props.put("mail.smtps.auth", "true");
            props.put("mail.smtps.connectiontimeout", timeout);
            props.put("mail.smtps.timeout", timeout);
            props.put("mail.smtps.writetimeout", timeout);
        } else {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        return sender;
    }
}
