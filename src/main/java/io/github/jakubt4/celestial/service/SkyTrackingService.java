package io.github.jakubt4.celestial.service;

import io.github.jakubt4.celestial.astro.CelestialBodiesCalculator;
import io.github.jakubt4.celestial.astro.GeodeticLocation;
import io.github.jakubt4.celestial.astro.SkySnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the current sky for one configured observer.
 *
 * <p>A {@code @Scheduled} loop recomputes a {@link SkySnapshot} at the configured rate and
 * swaps it into an {@link AtomicReference}, so readers always see one complete snapshot.
 * The observer can be moved at runtime via {@link #updateObserver}.
 */
@Slf4j
@Service
public class SkyTrackingService {

    private final Clock clock;

    private final AtomicReference<TrackedObserver> observer = new AtomicReference<>();
    private final AtomicReference<SkySnapshot> latestSnapshot = new AtomicReference<>();

    public SkyTrackingService(final Clock clock,
                              @Value("${celestial.observer.name:Null Island}") final String name,
                              @Value("${celestial.observer.latitude:0.0}") final double latitude,
                              @Value("${celestial.observer.longitude:0.0}") final double longitude) {
        this.clock = clock;
        this.observer.set(new TrackedObserver(name, GeodeticLocation.of(latitude, longitude)));
    }

    @PostConstruct
    void init() {
        final var tracked = observer.get();
        log.info("Sky tracker ready for [{}] at lat={} deg, lon={} deg",
                tracked.name(), tracked.location().latitudeDegrees(), tracked.location().longitudeDegrees());
    }

    /**
     * Replaces the tracked observer. The next tick computes the sky for the new location;
     * the previous snapshot stays readable until then.
     */
    public void updateObserver(final String name, final GeodeticLocation location) {
        observer.set(new TrackedObserver(name, location));
        log.info("Observer moved to [{}] at lat={} deg, lon={} deg",
                name, location.latitudeDegrees(), location.longitudeDegrees());
    }

    public GeodeticLocation currentObserver() {
        return observer.get().location();
    }

    public String currentObserverName() {
        return observer.get().name();
    }

    public Optional<SkySnapshot> latest() {
        return Optional.ofNullable(latestSnapshot.get());
    }

    /** Sky for an arbitrary observer and instant; does not touch the tracked snapshot. */
    public SkySnapshot snapshotAt(final Instant instant, final GeodeticLocation location) {
        return CelestialBodiesCalculator.getSkySnapshot(instant, location);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Recomputes the sky for the tracked observer at the current clock instant.
     * Invoked by Spring's scheduler.
     */
    @Scheduled(fixedRateString = "${celestial.tracking.interval-ms:60000}",
            initialDelayString = "${celestial.tracking.initial-delay-ms:0}")
    public void track() {
        final var tracked = observer.get();
        try {
            final var snapshot = CelestialBodiesCalculator.getSkySnapshot(clock.instant(), tracked.location());
            final var previous = latestSnapshot.getAndSet(snapshot);

            log.info("[{}] Sun az={} deg, el={} deg ({}) | Moon az={} deg, el={} deg, lit={} ({})",
                    tracked.name(),
                    String.format("%.2f", snapshot.sun().azimuthDegrees()),
                    String.format("%.2f", snapshot.sun().elevationDegrees()),
                    snapshot.sun().phase(),
                    String.format("%.2f", snapshot.moon().azimuthDegrees()),
                    String.format("%.2f", snapshot.moon().elevationDegrees()),
                    String.format("%.2f", snapshot.moon().illumination()),
                    snapshot.moon().phase());

            if (previous != null && previous.sun().phase() != snapshot.sun().phase()) {
                log.info("[{}] Sun phase changed {} -> {}",
                        tracked.name(), previous.sun().phase(), snapshot.sun().phase());
            }
            if (previous != null && previous.moon().phase() != snapshot.moon().phase()) {
                log.info("[{}] Moon phase changed {} -> {}",
                        tracked.name(), previous.moon().phase(), snapshot.moon().phase());
            }
        } catch (final Exception e) {
            log.error("[{}] Sky tracking error: {}", tracked.name(), e.getMessage());
        }
    }

    private record TrackedObserver(String name, GeodeticLocation location) {
    }
}
