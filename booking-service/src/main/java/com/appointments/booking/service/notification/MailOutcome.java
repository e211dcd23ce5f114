package com.appointments.booking.service.notification;

public enum MailOutcome {

    SENT,

    /** SMTP settings are absent; the message was skipped on purpose. */
    NOT_CONFIGURED,

    /** The relay refused the message or could not be reached. */
    FAILED
}
