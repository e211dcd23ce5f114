package com.appointments.booking.service.notification;

import com.appointments.booking.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * SMTP-backed sender for booking confirmations and thank-you messages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailNotificationSender implements NotificationSender {

    static final String CONFIRMATION_SUBJECT = "Conferma prenotazione";
    static final String THANK_YOU_SUBJECT = "Grazie per la visita";
    static final String NO_NOTE = "Nessuna nota.";

    private final JavaMailSender mailSender;
    private final MailSettings settings;

    @Override
    public MailOutcome sendConfirmation(Booking booking, String cancelUrl) {
        SimpleMailMessage message = newMessage(booking, CONFIRMATION_SUBJECT);
        if (settings.hasNotifyAddress()) {
            message.setBcc(settings.getNotify());
        }
        String note = StringUtils.hasText(booking.getNote()) ? booking.getNote() : NO_NOTE;
        message.setText(String.join("\n",
                "Grazie per la tua richiesta di prenotazione.",
                "",
                "Nome: " + booking.getFullName(),
                "Telefono: " + booking.getPhone(),
                "Email: " + booking.getEmail(),
                "Data e ora: " + booking.getDisplayDateTime(),
                "Note: " + note,
                "",
                "Se devi annullare la prenotazione, usa questo link:",
                cancelUrl,
                "",
                "Ti contatteremo a breve per confermare."));

        return send(message, "confirmation", booking);
    }

    @Override
    public MailOutcome sendThankYou(Booking booking) {
        SimpleMailMessage message = newMessage(booking, THANK_YOU_SUBJECT);
        message.setText(String.join("\n",
                "Ciao " + booking.getFullName() + ",",
                "",
                "grazie per la tua visita del " + booking.getDisplayDateTime() + ".",
                "Speriamo di rivederti presto."));

        return send(message, "thank-you", booking);
    }

    private SimpleMailMessage newMessage(Booking booking, String subject) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(settings.getFrom());
        message.setTo(booking.getEmail());
        message.setSubject(subject);
        return message;
    }

    private MailOutcome send(SimpleMailMessage message, String kind, Booking booking) {
        if (!settings.isConfigured()) {
            log.debug("SMTP not configured, skipping {} email for booking {}", kind, booking.getId());
            return MailOutcome.NOT_CONFIGURED;
        }

        try {
            mailSender.send(message);
            log.info("Sent {} email for booking {}", kind, booking.getId());
            return MailOutcome.SENT;
        } catch (MailException e) {
            log.warn("Failed to send {} email for booking {}: {}", kind, booking.getId(), e.getMessage());
            return MailOutcome.FAILED;
        }
    }
}
