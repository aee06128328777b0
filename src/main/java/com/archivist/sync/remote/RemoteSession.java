package com.archivist.sync.remote;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * A played session; the source of recap sheets.
 *
 * @param sessionDate ISO date or date-time string, null when the session is undated
 */
public record RemoteSession(String id, String title, String summary, String sessionDate) {

    public RemoteSession {
        Objects.requireNonNull(id, "id is required");
        title = title != null && !title.isBlank() ? title : "Session";
        summary = summary != null ? summary : "";
        sessionDate = sessionDate != null && !sessionDate.isBlank() ? sessionDate : null;
    }

    public boolean isDated() {
        return sessionDate != null;
    }

    /**
     * The session date as an instant. Offset date-times keep their offset; local date-times
     * and plain dates are read as UTC. Empty when undated or unparseable.
     */
    public Optional<Instant> sessionInstant() {
        if (sessionDate == null) {
            return Optional.empty();
        }
        String value = sessionDate.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset
        }
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // not a date-time
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
