package io.github.jakubt4.celestial.controller;

import io.github.jakubt4.celestial.astro.GeodeticLocation;
import io.github.jakubt4.celestial.astro.SkySnapshot;
import io.github.jakubt4.celestial.dto.ObserverRequest;
import io.github.jakubt4.celestial.dto.ObserverResponse;
import io.github.jakubt4.celestial.dto.SkyResponse;
import io.github.jakubt4.celestial.service.SkyTrackingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

/**
 * REST endpoints for Sun and Moon queries.
 *
 * <p>{@code GET /api/sky}, {@code /api/sky/sun} and {@code /api/sky/moon} compute the sky
 * for any observer at {@code at} (ISO-8601, defaults to now). {@code GET /api/sky/current}
 * serves the tracker's latest snapshot and {@code POST /api/sky/observer} moves the
 * tracked observer.
 */
@Slf4j
@RestController
@RequestMapping("/api/sky")
@RequiredArgsConstructor
public class SkyController {

    private final SkyTrackingService skyTrackingService;

    @GetMapping
    public ResponseEntity<SkyResponse> sky(@RequestParam(name = "lat", required = false) final Double lat,
                                           @RequestParam(name = "lon", required = false) final Double lon,
                                           @RequestParam(name = "at", required = false) final String at) {
        return query(lat, lon, at, SkyResponse::ok);
    }

    @GetMapping("/sun")
    public ResponseEntity<SkyResponse> sun(@RequestParam(name = "lat", required = false) final Double lat,
                                           @RequestParam(name = "lon", required = false) final Double lon,
                                           @RequestParam(name = "at", required = false) final String at) {
        return query(lat, lon, at, SkyResponse::sunOnly);
    }

    @GetMapping("/moon")
    public ResponseEntity<SkyResponse> moon(@RequestParam(name = "lat", required = false) final Double lat,
                                            @RequestParam(name = "lon", required = false) final Double lon,
                                            @RequestParam(name = "at", required = false) final String at) {
        return query(lat, lon, at, SkyResponse::moonOnly);
    }

    @GetMapping("/current")
    public ResponseEntity<SkyResponse> current() {
        return skyTrackingService.latest()
                .map(snapshot -> ResponseEntity.ok(SkyResponse.ok(snapshot)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(SkyResponse.waiting("No sky snapshot computed yet")));
    }

    /**
     * Moves the tracked observer.
     *
     * @return {@code 200 OK} with TRACKING status, {@code 400 Bad Request} when the name is
     *         blank or a coordinate is missing or out of range
     */
    @PostMapping("/observer")
    public ResponseEntity<ObserverResponse> updateObserver(@RequestBody final ObserverRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(new ObserverResponse(null, "REJECTED", "Observer name is required"));
        }
        final var problem = validateLocation(request.latitude(), request.longitude());
        if (problem != null) {
            log.warn("Observer update for [{}] rejected: {}", request.name(), problem);
            return ResponseEntity.badRequest()
                    .body(new ObserverResponse(request.name(), "REJECTED", problem));
        }

        skyTrackingService.updateObserver(request.name(), GeodeticLocation.of(request.latitude(), request.longitude()));
        return ResponseEntity.ok(new ObserverResponse(request.name(), "TRACKING", "Observer updated"));
    }

    private ResponseEntity<SkyResponse> query(final Double lat, final Double lon, final String at,
                                              final Function<SkySnapshot, SkyResponse> view) {
        final var problem = validateLocation(lat, lon);
        if (problem != null) {
            log.warn("Sky query rejected: {}", problem);
            return ResponseEntity.badRequest().body(SkyResponse.rejected(problem));
        }

        final Instant instant;
        try {
            instant = at == null || at.isBlank() ? skyTrackingService.now() : Instant.parse(at);
        } catch (final DateTimeParseException e) {
            log.warn("Sky query rejected, unparsable instant [{}]: {}", at, e.getMessage());
            return ResponseEntity.badRequest().body(SkyResponse.rejected("Invalid instant: " + at));
        }

        final var snapshot = skyTrackingService.snapshotAt(instant, GeodeticLocation.of(lat, lon));
        return ResponseEntity.ok(view.apply(snapshot));
    }

    private static String validateLocation(final Double latitude, final Double longitude) {
        if (latitude == null || longitude == null) {
            return "Latitude and longitude are required";
        }
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            return "Latitude must be within [-90, 90]";
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            return "Longitude must be within [-180, 180]";
        }
        return null;
    }
}
