package in.co.kitree.jyotish.services;

import com.google.gson.Gson;
import in.co.kitree.jyotish.pojos.GeoLocation;
import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class FreeAstrologyApiEphemerisTest {

    private static final double JD = 2451545.0;
    private static final GeoLocation DELHI = GeoLocation.of(28.65195, 77.23149);

    private static final String FIRST_READING = """
            {
                "statusCode": 200,
                "output": [
                    {
                        "0": {"name": "Ascendant", "fullDegree": 322.29098802770164}
                    },
                    {
                        "Ascendant": {"fullDegree": 322.29098802770164, "isRetro": "false"},
                        "Sun": {"fullDegree": 268.44, "isRetro": "false"},
                        "Moon": {"fullDegree": 10.0, "isRetro": "false"},
                        "Rahu": {"fullDegree": 95.5, "isRetro": "true"},
                        "ayanamsa": {"value": 23.85}
                    }
                ]
            }
            """;

    private static final String HOUR_LATER = """
            {
                "statusCode": 200,
                "output": [
                    {},
                    {
                        "Ascendant": {"fullDegree": 337.3},
                        "Sun": {"fullDegree": 268.48},
                        "Moon": {"fullDegree": 10.55},
                        "Rahu": {"fullDegree": 95.4978}
                    }
                ]
            }
            """;

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> firstResponse;

    @Mock
    private HttpResponse<String> laterResponse;

    private FreeAstrologyApiEphemeris ephemeris;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        when(firstResponse.statusCode()).thenReturn(200);
        when(firstResponse.body()).thenReturn(FIRST_READING);
        when(laterResponse.statusCode()).thenReturn(200);
        when(laterResponse.body()).thenReturn(HOUR_LATER);
        ephemeris = new FreeAstrologyApiEphemeris(httpClient, "test-key", DELHI, EngineSettings.defaults());
    }

    // =========================================================================
    // Response parsing
    // =========================================================================

    @Test
    public void testParseLongitudes() {
        Map<String, Double> longitudes = FreeAstrologyApiEphemeris.parseLongitudes(FIRST_READING, new Gson());
        assertEquals(4, longitudes.size());
        assertEquals(268.44, longitudes.get("Sun"), 1e-9);
        assertEquals(322.29098802770164, longitudes.get(FreeAstrologyApiEphemeris.ASCENDANT_KEY), 1e-9);
        assertFalse(longitudes.containsKey("ayanamsa"));
    }

    @Test
    public void testParseLongitudesRejectsUnexpectedShapes() {
        Gson gson = new Gson();
        assertThrows(EphemerisException.class, () -> FreeAstrologyApiEphemeris.parseLongitudes("{\"output\": []}", gson));
        assertThrows(EphemerisException.class, () -> FreeAstrologyApiEphemeris.parseLongitudes("{\"output\": [{}, 3]}", gson));
        assertThrows(EphemerisException.class, () -> FreeAstrologyApiEphemeris.parseLongitudes("not json", gson));
        assertThrows(EphemerisException.class, () -> FreeAstrologyApiEphemeris.parseLongitudes("", gson));
    }

    @Test
    public void testRequestPayloadIsUtc() {
        Map<String, Object> payload = ephemeris.requestPayload(FreeAstrologyApiEphemeris.toWholeSecond(JD),
                28.65195, 77.23149);
        assertEquals(2000, payload.get("year"));
        assertEquals(1, payload.get("month"));
        assertEquals(1, payload.get("date"));
        assertEquals(12, payload.get("hours"));
        assertEquals(0, payload.get("minutes"));
        assertEquals(0, payload.get("seconds"));
        assertEquals(0.0, payload.get("timezone"));
        assertEquals(Map.of("observation_point", "topocentric", "ayanamsha", "lahiri"), payload.get("settings"));
    }

    @Test
    public void testRequestPayloadSendsWholeSeconds() {
        Map<String, Object> payload = ephemeris.requestPayload(
                FreeAstrologyApiEphemeris.toWholeSecond(JD + 29.6 / 86400.0), 28.65195, 77.23149);
        assertEquals(30, payload.get("seconds"));
        assertInstanceOf(Integer.class, payload.get("seconds"));
    }

    // =========================================================================
    // HTTP round trips
    // =========================================================================

    @Test
    public void testLongitudeNeedsOneReading() throws Exception {
        doReturn(firstResponse, laterResponse).when(httpClient).send(any(), any());

        assertEquals(268.44, ephemeris.longitude(Planet.SUN, JD), 1e-9);
        assertEquals(10.0, ephemeris.longitude(Planet.MOON, JD), 1e-9);
        assertEquals(275.5, ephemeris.longitude(Planet.KETU, JD), 1e-9);
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    public void testInstantsWithinOneSecondShareAReading() throws Exception {
        doReturn(firstResponse, laterResponse).when(httpClient).send(any(), any());

        ephemeris.longitude(Planet.SUN, JD);
        ephemeris.longitude(Planet.SUN, JD + 0.2 / 86400.0);
        ephemeris.longitude(Planet.MOON, JD - 0.2 / 86400.0);
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    public void testPositionEstimatesSpeedFromSecondReading() throws Exception {
        doReturn(firstResponse, laterResponse).when(httpClient).send(any(), any());

        SiderealPosition sun = ephemeris.position(Planet.SUN, JD);
        assertEquals(268.44, sun.longitude, 1e-9);
        assertEquals(0.04 * 24, sun.speed, 1e-6);

        SiderealPosition moon = ephemeris.position(Planet.MOON, JD);
        assertEquals(0.55 * 24, moon.speed, 1e-6);
        // both readings are cached per instant
        verify(httpClient, times(2)).send(any(), any());
    }

    @Test
    public void testKetuIsOppositeRahu() throws Exception {
        doReturn(firstResponse, laterResponse).when(httpClient).send(any(), any());
        SiderealPosition ketu = ephemeris.position(Planet.KETU, JD);
        assertEquals(275.5, ketu.longitude, 1e-9);
        assertTrue(ketu.isRetrograde());
    }

    @Test
    public void testAscendantUsesRequestedPlace() throws Exception {
        doReturn(firstResponse).when(httpClient).send(any(), any());
        assertEquals(322.29098802770164, ephemeris.siderealAscendant(JD, 19.076, 72.8777), 1e-9);
    }

    @Test
    public void testNonSuccessStatusFails() throws Exception {
        when(firstResponse.statusCode()).thenReturn(503);
        doReturn(firstResponse).when(httpClient).send(any(), any());
        assertThrows(EphemerisException.class, () -> ephemeris.position(Planet.SUN, JD));
    }

    @Test
    public void testNetworkFailureIsWrapped() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());
        EphemerisException e = assertThrows(EphemerisException.class, () -> ephemeris.position(Planet.SUN, JD));
        assertEquals(EphemerisException.CODE, e.getErrorCode());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    public void testMissingApiKeyFailsWithoutCalling() {
        FreeAstrologyApiEphemeris noKey = new FreeAstrologyApiEphemeris(httpClient, "", DELHI,
                EngineSettings.defaults());
        assertThrows(EphemerisException.class, () -> noKey.position(Planet.SUN, JD));
        verifyNoInteractions(httpClient);
    }
}
