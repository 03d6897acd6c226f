package io.github.jakubt4.celestial.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.jakubt4.celestial.astro.SkySnapshot;

import java.time.Instant;

/**
 * Sky query result.
 *
 * <p>{@code status} is {@code "OK"} with the requested bodies filled in,
 * {@code "REJECTED"} for invalid input or {@code "WAITING"} when the tracker has
 * not produced a snapshot yet. Absent parts are omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkyResponse(String status,
                          String message,
                          Instant instant,
                          Double latitude,
                          Double longitude,
                          SunResponse sun,
                          MoonResponse moon) {

    public static SkyResponse ok(final SkySnapshot snapshot) {
        return new SkyResponse("OK", null,
                snapshot.instant(),
                snapshot.location().latitudeDegrees(),
                snapshot.location().longitudeDegrees(),
                SunResponse.of(snapshot.sun()),
                MoonResponse.of(snapshot.moon(), snapshot.moonIllumination()));
    }

    public static SkyResponse sunOnly(final SkySnapshot snapshot) {
        final var full = ok(snapshot);
        return new SkyResponse(full.status(), null, full.instant(), full.latitude(), full.longitude(), full.sun(), null);
    }

    public static SkyResponse moonOnly(final SkySnapshot snapshot) {
        final var full = ok(snapshot);
        return new SkyResponse(full.status(), null, full.instant(), full.latitude(), full.longitude(), null, full.moon());
    }

    public static SkyResponse rejected(final String message) {
        return new SkyResponse("REJECTED", message, null, null, null, null, null);
    }

    public static SkyResponse waiting(final String message) {
        return new SkyResponse("WAITING", message, null, null, null, null, null);
    }
}
