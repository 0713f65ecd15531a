package dev.juridica.rag.cache;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One message of a conversation as kept in the state cache.
 */
public record ConversationTurn(Role role, String message, Instant timestamp) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ConversationTurn user(String message, Instant timestamp) {
        return new ConversationTurn(Role.USER, message, timestamp);
    }

    public static ConversationTurn assistant(String message, Instant timestamp) {
        return new ConversationTurn(Role.ASSISTANT, message, timestamp);
    }

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String value;

        Role(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
