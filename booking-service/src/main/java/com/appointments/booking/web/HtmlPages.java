package com.appointments.booking.web;

import com.appointments.booking.model.Booking;
import com.appointments.booking.service.notification.MailOutcome;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Map;

/**
 * Small HTML responses for the public booking flow and the admin login.
 * Every value taken from a request is escaped.
 */
@Component
public class HtmlPages {

    private static final Map<String, String[]> ERROR_TEXTS = Map.of(
            "MISSING_FIELDS", new String[]{"Dati mancanti", "Compila tutti i campi obbligatori."},
            "INVALID_BODY", new String[]{"Dati mancanti", "Compila tutti i campi obbligatori."},
            "INVALID_DATE", new String[]{"Data non valida", "Seleziona una data corretta."},
            "DATE_OUT_OF_RANGE", new String[]{"Data fuori intervallo", "Seleziona una data entro 2 mesi."},
            "INVALID_TIME", new String[]{"Orario non valido", "Seleziona un orario valido."},
            "SLOT_UNAVAILABLE", new String[]{"Slot non disponibile", "Seleziona un altro orario."},
            "MISSING_TOKEN", new String[]{"Token mancante", "Impossibile annullare."},
            "BOOKING_NOT_FOUND", new String[]{"Token non valido", "Richiesta non trovata."});

    private static final String LAYOUT = """
            <!doctype html>
            <html lang="it">
              <head>
                <meta charset="UTF-8" />
                <meta name="viewport" content="width=device-width, initial-scale=1.0" />
                <title>%s</title>
                <style>
                  body { font-family: Arial, sans-serif; padding: 40px; background: #f8fafc; color: #0b0f1a; }
                  .card { max-width: 520px; margin: 0 auto; background: #fff; padding: 32px; border-radius: 24px; }
                  a { color: #0b0f1a; }
                  label { display: block; margin-top: 12px; }
                  .error { color: #b91c1c; }
                </style>
              </head>
              <body>
                <div class="card">
            %s
                </div>
              </body>
            </html>
            """;

    public String confirmation(Booking booking, MailOutcome emailOutcome) {
        String body = """
                <h1>Grazie, %s.</h1>
                <p>La tua richiesta e stata registrata per <strong>%s</strong>.</p>
                <p><strong>%s</strong></p>
                <p>Se devi annullare: <a href="/annulla?token=%s">Annulla prenotazione</a></p>
                <p><a href="/">Torna alla pagina principale</a></p>
                """.formatted(
                escape(booking.getFullName()),
                escape(booking.getDisplayDateTime()),
                escape(emailStatus(emailOutcome)),
                escape(booking.getToken()));
        return page("Prenotazione ricevuta", body);
    }

    public String cancellation(boolean alreadyCanceled) {
        if (alreadyCanceled) {
            return message("Prenotazione gia annullata", "Nessuna azione necessaria.");
        }
        return message("Prenotazione annullata", "Lo slot e di nuovo disponibile.");
    }

    public String error(String errorCode, String fallbackMessage) {
        String[] texts = ERROR_TEXTS.get(errorCode);
        if (texts == null) {
            return message("Richiesta non valida", fallbackMessage);
        }
        return message(texts[0], texts[1]);
    }

    public String login(String errorMessage) {
        String error = errorMessage == null ? "" : "<p class=\"error\">" + escape(errorMessage) + "</p>";
        String body = """
                <h1>Area amministrazione</h1>
                %s
                <form method="post" action="/admin/login">
                  <label>Utente <input name="username" autocomplete="username" required /></label>
                  <label>Password <input name="password" type="password" autocomplete="current-password" required /></label>
                  <p><button type="submit">Accedi</button></p>
                </form>
                """.formatted(error);
        return page("Accesso amministratore", body);
    }

    private String message(String title, String text) {
        return page(title, "<h1>" + escape(title) + "</h1><p>" + escape(text) + "</p>");
    }

    private String page(String title, String body) {
        return LAYOUT.formatted(escape(title), body);
    }

    private static String emailStatus(MailOutcome outcome) {
        return switch (outcome) {
            case SENT -> "Conferma inviata via email.";
            case NOT_CONFIGURED -> "Prenotazione salvata. Configura SMTP per inviare la conferma.";
            case FAILED -> "Prenotazione salvata. Non e stato possibile inviare la conferma via email.";
        };
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
