package com.example.hipagent.model;

/**
 * Composed prompt, sent to the generation service as a system message and a user message.
 */
public record Prompt(
        String system,
        String user
) {
    public Prompt {
        system = system == null ? "" : system;
        user = user == null ? "" : user;
    }

    /** Both parts as one block of text, system first. */
    public String text() {
        if (system.isEmpty()) {
            return user;
        }
        return system + "\n\n" + user;
    }
}
