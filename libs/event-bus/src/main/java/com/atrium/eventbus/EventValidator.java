package com.atrium.eventbus;

/**
 * Validates {@link AppEvent} envelopes before they are delivered.
 *
 * <p>Collects every problem instead of stopping at the first one.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the envelope fields and that the payload matches the channel's payload type.
     *
     * @param key channel the event is published on
     * @param event the envelope to check
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(EventKey<?> key, AppEvent<?> event) {
        var errors = new java.util.ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (!key.name().equals(event.name())) {
            errors.add("name '%s' does not match channel '%s'".formatted(event.name(), key.name()));
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.source())) {
            errors.add("source must not be null or blank");
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        } else if (!key.payloadType().isInstance(event.payload())) {
            errors.add("payload of type %s is not a %s".formatted(
                    event.payload().getClass().getName(), key.payloadType().getName()));
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
