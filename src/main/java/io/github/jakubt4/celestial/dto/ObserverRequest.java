package io.github.jakubt4.celestial.dto;

/**
 * Inbound request moving the tracked observer.
 *
 * @param name      human-readable observer label (e.g. "Greenwich")
 * @param latitude  degrees, north-positive, within [-90, 90]
 * @param longitude degrees, east-positive, within [-180, 180]
 */
public record ObserverRequest(String name, Double latitude, Double longitude) {
}
