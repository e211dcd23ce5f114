package com.appointments.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String FIRST_NAME_REQUIRED = "Il nome e obbligatorio";
    public static final String LAST_NAME_REQUIRED = "Il cognome e obbligatorio";
    public static final String PHONE_REQUIRED = "Il telefono e obbligatorio";
    public static final String EMAIL_REQUIRED = "L'email e obbligatoria";
    public static final String DATE_REQUIRED = "La data e obbligatoria";
    public static final String TIME_REQUIRED = "L'orario e obbligatorio";
    public static final String PRIVACY_REQUIRED = "Il consenso privacy e obbligatorio";

    public static final String MISSING_FIELDS = "Compila tutti i campi obbligatori.";
    public static final String INVALID_DATE = "Seleziona una data corretta.";
    public static final String DATE_OUT_OF_RANGE = "Seleziona una data entro 2 mesi.";
    public static final String INVALID_TIME = "Seleziona un orario valido.";
    public static final String SLOT_UNAVAILABLE = "Seleziona un altro orario.";

    public static final String TOKEN_REQUIRED = "Impossibile annullare.";
    public static final String ID_REQUIRED = "L'id della prenotazione e obbligatorio";
    public static final String INVALID_ID = "Id prenotazione non valido";
    public static final String INVALID_FLAG = "Valore non valido per il campo %s";
    public static final String INVALID_BODY = "Corpo della richiesta non valido";

    public static final String BOOKING_NOT_FOUND = "Prenotazione non trovata";
    public static final String UNAUTHORIZED = "Accesso amministratore richiesto";
}
