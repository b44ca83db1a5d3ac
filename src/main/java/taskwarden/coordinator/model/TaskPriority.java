package taskwarden.coordinator.model;

import java.util.Locale;

/**
 * Task priority tiers. Lower value is dequeued first.
 */
public enum TaskPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4),
    BATCH(5);

    private final int value;

    TaskPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /** Background tiers run with a lowered thread priority. */
    public boolean isBackground() {
        return this == LOW || this == BATCH;
    }

    public static TaskPriority fromValue(int value) {
        for (TaskPriority p : values()) {
            if (p.value == value) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority value: " + value);
    }

    /**
     * Parse a priority by name (case-insensitive) or by numeric value.
     */
    public static TaskPriority parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("priority is required");
        }
        String trimmed = text.trim();
        if (Character.isDigit(trimmed.charAt(0))) {
            return fromValue(Integer.parseInt(trimmed));
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + text);
        }
    }
}
