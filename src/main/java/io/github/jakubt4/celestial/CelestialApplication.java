package io.github.jakubt4.celestial;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Celestial: Sun and Moon ephemeris service for scene lighting.
 *
 * <p>Computes low-precision horizontal positions, lunar illumination and twilight/lunar
 * phases for an observer, answers ad-hoc queries over REST and keeps a periodically
 * refreshed sky snapshot for a configured observer.
 *
 * @see io.github.jakubt4.celestial.astro.CelestialBodiesCalculator
 * @see io.github.jakubt4.celestial.service.SkyTrackingService
 */
@SpringBootApplication
@EnableScheduling
public class CelestialApplication {

    public static void main(String[] args) {
        SpringApplication.run(CelestialApplication.class, args);
    }
}
