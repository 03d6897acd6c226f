package io.github.jakubt4.celestial.dto;

/**
 * Response returned after an observer update attempt.
 *
 * @param name    observer the update was submitted for (may be {@code null} on early rejection)
 * @param status  outcome, {@code "TRACKING"} if the observer was accepted, {@code "REJECTED"} otherwise
 * @param message human-readable detail about the result
 */
public record ObserverResponse(String name, String status, String message) {
}
