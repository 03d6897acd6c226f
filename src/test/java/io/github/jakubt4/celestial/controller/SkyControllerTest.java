package io.github.jakubt4.celestial.controller;

import io.github.jakubt4.celestial.astro.CelestialBodiesCalculator;
import io.github.jakubt4.celestial.astro.GeodeticLocation;
import io.github.jakubt4.celestial.service.SkyTrackingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SkyController.class)
class SkyControllerTest {

    private static final Instant NOW = Instant.parse("2024-04-23T23:49:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SkyTrackingService skyTrackingService;

    @BeforeEach
    void computeWithRealEngine() {
        when(skyTrackingService.now()).thenReturn(NOW);
        when(skyTrackingService.snapshotAt(any(), any())).thenAnswer(invocation ->
                CelestialBodiesCalculator.getSkySnapshot(invocation.getArgument(0), invocation.getArgument(1)));
    }

    @Test
    void skyReturnsSunAndMoonForRequestedInstant() throws Exception {
        mockMvc.perform(get("/api/sky")
                        .param("lat", "51.4769")
                        .param("lon", "0")
                        .param("at", "2024-06-21T12:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.instant").value("2024-06-21T12:00:00Z"))
                .andExpect(jsonPath("$.latitude").value(51.4769))
                .andExpect(jsonPath("$.sun.phase").value("DAY"))
                .andExpect(jsonPath("$.moon.phase").exists())
                .andExpect(jsonPath("$.moon.distanceKm").isNumber())
                .andExpect(jsonPath("$.message").doesNotExist());

        verify(skyTrackingService).snapshotAt(Instant.parse("2024-06-21T12:00:00Z"), GeodeticLocation.of(51.4769, 0));
        verify(skyTrackingService, never()).now();
    }

    @Test
    void missingInstantDefaultsToServiceClock() throws Exception {
        mockMvc.perform(get("/api/sky/moon")
                        .param("lat", "51.4769")
                        .param("lon", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instant").value("2024-04-23T23:49:00Z"))
                .andExpect(jsonPath("$.moon.illumination").value(org.hamcrest.Matchers.greaterThan(0.97)))
                .andExpect(jsonPath("$.sun").doesNotExist());

        verify(skyTrackingService).now();
    }

    @Test
    void sunEndpointOmitsMoon() throws Exception {
        mockMvc.perform(get("/api/sky/sun")
                        .param("lat", "0")
                        .param("lon", "0")
                        .param("at", "2024-02-20T12:14:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sun.phase").value("DAY"))
                .andExpect(jsonPath("$.sun.elevationDegrees").value(org.hamcrest.Matchers.greaterThan(66.0)))
                .andExpect(jsonPath("$.moon").doesNotExist());
    }

    @Test
    void rejectsMissingCoordinates() throws Exception {
        mockMvc.perform(get("/api/sky").param("lat", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value("Latitude and longitude are required"));
    }

    @Test
    void rejectsOutOfRangeLatitude() throws Exception {
        mockMvc.perform(get("/api/sky/sun").param("lat", "95").param("lon", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Latitude")));

        verify(skyTrackingService, never()).snapshotAt(any(), any());
    }

    @Test
    void rejectsOutOfRangeLongitude() throws Exception {
        mockMvc.perform(get("/api/sky/moon").param("lat", "0").param("lon", "-181"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Longitude")));
    }

    @Test
    void rejectsUnparsableInstant() throws Exception {
        mockMvc.perform(get("/api/sky")
                        .param("lat", "0")
                        .param("lon", "0")
                        .param("at", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Invalid instant")));
    }

    @Test
    void currentReportsWaitingBeforeFirstTick() throws Exception {
        when(skyTrackingService.latest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sky/current"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("WAITING"));
    }

    @Test
    void currentServesTrackedSnapshot() throws Exception {
        final var snapshot = CelestialBodiesCalculator.getSkySnapshot(NOW, GeodeticLocation.of(51.4769, 0));
        when(skyTrackingService.latest()).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/sky/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.instant").value("2024-04-23T23:49:00Z"))
                .andExpect(jsonPath("$.sun.phase").value(snapshot.sun().phase().name()))
                .andExpect(jsonPath("$.moon.phase").value(snapshot.moon().phase().name()));
    }

    @Test
    void updateObserverReturnsTrackingForValidPayload() throws Exception {
        mockMvc.perform(post("/api/sky/observer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "name": "Oslo",
                                    "latitude": 59.91,
                                    "longitude": 10.75
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Oslo"))
                .andExpect(jsonPath("$.status").value("TRACKING"));

        verify(skyTrackingService).updateObserver("Oslo", GeodeticLocation.of(59.91, 10.75));
    }

    @Test
    void updateObserverRejectsBlankName() throws Exception {
        mockMvc.perform(post("/api/sky/observer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "name": " ",
                                    "latitude": 59.91,
                                    "longitude": 10.75
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        verify(skyTrackingService, never()).updateObserver(anyString(), any());
    }

    @Test
    void updateObserverRejectsMissingLongitude() throws Exception {
        mockMvc.perform(post("/api/sky/observer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "name": "Nowhere",
                                    "latitude": 10.0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.name").value("Nowhere"))
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }
}
