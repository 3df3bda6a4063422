package in.co.kitree.jyotish.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.kitree.jyotish.pojos.Chart;
import in.co.kitree.jyotish.pojos.ChartPosition;
import in.co.kitree.jyotish.pojos.DashaInterval;
import in.co.kitree.jyotish.pojos.DashaTimeline;
import in.co.kitree.jyotish.pojos.GeoLocation;
import in.co.kitree.jyotish.pojos.JyotishRequest;
import in.co.kitree.jyotish.pojos.KaranaSpan;
import in.co.kitree.jyotish.pojos.NakshatraPlacement;
import in.co.kitree.jyotish.pojos.NatalPositions;
import in.co.kitree.jyotish.pojos.Panchanga;
import in.co.kitree.jyotish.pojos.PanchangaElement;
import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JSON entry point for chart, panchanga and dasha requests.
 *
 * <p>Every response carries {@code success}. Missing request fields and engine rejections come back as
 * {@code {"success": false, "errorCode": ..., "errorMessage": ...}}; nothing is retried. Responses are
 * built from insertion-ordered maps, so the same request always serializes to the same bytes.</p>
 */
public class JyotishService {

    private final EngineSettings settings;
    private final Function<GeoLocation, EphemerisAdapter> ephemerisFactory;
    private final SunriseProvider sunriseProvider;
    private final Gson gson;

    public JyotishService() {
        this(EngineSettings.load());
    }

    public JyotishService(EngineSettings settings) {
        this(settings,
                location -> new CachingEphemerisAdapter(new FreeAstrologyApiEphemeris(location, settings)),
                new NoaaSunriseCalculator());
    }

    /**
     * @param ephemerisFactory adapter for an observer location; the Moon is read topocentrically
     */
    public JyotishService(EngineSettings settings, Function<GeoLocation, EphemerisAdapter> ephemerisFactory,
                          SunriseProvider sunriseProvider) {
        this.settings = settings;
        this.ephemerisFactory = ephemerisFactory;
        this.sunriseProvider = sunriseProvider;
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    /**
     * Routes on {@code function}. The logging context (request id, function, subject) lives for this call only.
     */
    public String handleRequest(JyotishRequest request) {
        String function = request.getFunction() == null ? "" : request.getFunction();
        LoggingService.initRequest(request.getRequestId());
        LoggingService.setFunction(function);
        LoggingService.setSubject(subjectOf(request));
        try {
            return switch (function) {
                case "get_birth_chart" -> getBirthChart(request);
                case "get_divisional_charts" -> getDivisionalCharts(request);
                case "get_panchanga" -> getPanchanga(request);
                case "get_dasha_details" -> getDashaDetails(request);
                default -> error(InputDomainException.CODE, "Unknown function: " + function);
            };
        } finally {
            LoggingService.clearContext();
        }
    }

    /** "lat,lon@yyyy-mm-dd", or null when the request has no place or date. */
    static String subjectOf(JyotishRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null || request.getYear() == null
                || request.getMonth() == null || request.getDate() == null) {
            return null;
        }
        return String.format(Locale.ROOT, "%.4f,%.4f@%04d-%02d-%02d", request.getLatitude(), request.getLongitude(),
                request.getYear(), request.getMonth(), request.getDate());
    }

    /**
     * Rasi chart with nakshatra details for every body.
     */
    public String getBirthChart(JyotishRequest request) {
        if (missingBirthDetails(request)) {
            return error(InputDomainException.CODE, "Missing required birth details");
        }
        return respond("birth_chart", request, () -> {
            BirthMoment birth = birthMoment(request);
            ChartService chartService = new ChartService(ephemerisFactory.apply(birth.location));
            NatalPositions natal = chartService.natalPositions(
                    birth.julianDay, birth.location.latitude, birth.location.longitude);
            Chart chart = chartService.buildChart(natal, VargaCatalog.byDivision(1));

            Map<String, Object> planets = new LinkedHashMap<>();
            for (Planet planet : Planet.values()) {
                SiderealPosition raw = natal.get(planet);
                Map<String, Object> entry = positionJson(chart.get(planet));
                entry.put("longitude", raw.longitude);
                entry.put("speed", raw.speed);
                entry.putAll(nakshatraJson(raw.longitude));
                planets.put(planet.getDisplayName(), entry);
            }
            Map<String, Object> ascendant = positionJson(chart.ascendant);
            ascendant.put("longitude", natal.ascendantLongitude);
            ascendant.putAll(nakshatraJson(natal.ascendantLongitude));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("julianDay", birth.julianDay);
            body.put("timezone", birth.zone.getId());
            body.put("ayanamsa", settings.getAyanamsa());
            body.put("ascendant", ascendant);
            body.put("planets", planets);
            return body;
        });
    }

    public String getDivisionalCharts(JyotishRequest request) {
        if (missingBirthDetails(request) || request.getDivisionalChartNumbers() == null
                || request.getDivisionalChartNumbers().isEmpty()) {
            return error(InputDomainException.CODE, "Missing required divisional chart details");
        }
        return respond("divisional_charts", request, () -> {
            BirthMoment birth = birthMoment(request);
            ChartService chartService = new ChartService(ephemerisFactory.apply(birth.location));
            NatalPositions natal = chartService.natalPositions(
                    birth.julianDay, birth.location.latitude, birth.location.longitude);

            Map<String, Object> charts = new LinkedHashMap<>();
            for (Chart chart : chartService.buildCharts(natal, request.getDivisionalChartNumbers())) {
                Map<String, Object> planets = new LinkedHashMap<>();
                for (Planet planet : Planet.values()) {
                    planets.put(planet.getDisplayName(), positionJson(chart.get(planet)));
                }
                Map<String, Object> chartJson = new LinkedHashMap<>();
                chartJson.put("name", chart.name);
                chartJson.put("divisionCount", chart.divisionCount);
                chartJson.put("ascendant", positionJson(chart.ascendant));
                chartJson.put("planets", planets);
                charts.put(chart.code, chartJson);
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("julianDay", birth.julianDay);
            body.put("timezone", birth.zone.getId());
            body.put("charts", charts);
            return body;
        });
    }

    public String getPanchanga(JyotishRequest request) {
        if (request.getDate() == null || request.getMonth() == null || request.getYear() == null
                || request.getLatitude() == null || request.getLongitude() == null) {
            return error(InputDomainException.CODE, "Missing required panchanga details");
        }
        return respond("panchanga", request, () -> {
            GeoLocation location = GeoLocation.of(request.getLatitude(), request.getLongitude());
            SignUtils.requireGeoLocation(location.latitude, location.longitude);
            LocalDate date = civilDate(request);
            ZoneId zone = TimezoneUtils.resolveZone(request.getTimezoneId(), location.latitude, location.longitude);
            Panchanga p = new PanchangaService(ephemerisFactory.apply(location), sunriseProvider, settings)
                    .compute(date, zone, location);
            return panchangaJson(p);
        });
    }

    public String getDashaDetails(JyotishRequest request) {
        if (missingBirthDetails(request)) {
            return error(InputDomainException.CODE, "Missing required dasha details");
        }
        return respond("dasha_details", request, () -> {
            BirthMoment birth = birthMoment(request);
            int depth = request.getDashaDepth() == null ? JyotishConfig.DEFAULT_DASHA_DEPTH : request.getDashaDepth();
            VimshottariDashaService.BalanceMode mode = balanceMode(request.getDashaBalanceMode());
            Instant horizon = null;
            if (request.getDashaHorizonYears() != null) {
                double days = request.getDashaHorizonYears() * settings.getDaysPerYear();
                horizon = birth.instant.plusNanos(Math.round(days * 86_400_000_000_000.0));
            }

            double moon = ephemerisFactory.apply(birth.location).longitude(Planet.MOON, birth.julianDay);
            DashaTimeline timeline = new VimshottariDashaService(settings)
                    .generate(birth.instant, moon, depth, horizon, mode);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("timezone", birth.zone.getId());
            body.put("moonLongitude", moon);
            body.put("birthNakshatra", timeline.birthNakshatra.getDisplayName());
            body.put("startingLord", timeline.startingLord.getDisplayName());
            body.put("elapsedFraction", timeline.elapsedFraction);
            body.put("balanceYears", timeline.balanceYears);
            body.put("depth", timeline.depth);
            body.put("balanceMode", mode.name());
            body.put("dashas", intervalsJson(timeline.root.children, birth.zone));
            return body;
        });
    }

    // =========================================================================
    // Request handling
    // =========================================================================

    private String respond(String operation, JyotishRequest request, Supplier<Map<String, Object>> body) {
        long start = LoggingService.logOperationStart(operation, LoggingService.data(
                "latitude", request.getLatitude(), "longitude", request.getLongitude(),
                "year", request.getYear(), "month", request.getMonth(), "date", request.getDate()));
        try {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.putAll(body.get());
            LoggingService.logOperationEnd(operation, start);
            return gson.toJson(response);
        } catch (JyotishException e) {
            LoggingService.logOperationFailed(operation, start, e);
            return error(e.getErrorCode(), e.getMessage());
        }
    }

    private String error(String errorCode, String errorMessage) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("errorCode", errorCode);
        response.put("errorMessage", errorMessage);
        return gson.toJson(response);
    }

    private static boolean missingBirthDetails(JyotishRequest r) {
        return r.getDate() == null || r.getMonth() == null || r.getYear() == null || r.getHour() == null
                || r.getMinute() == null || r.getLatitude() == null || r.getLongitude() == null;
    }

    private BirthMoment birthMoment(JyotishRequest r) {
        GeoLocation location = GeoLocation.of(r.getLatitude(), r.getLongitude());
        SignUtils.requireGeoLocation(location.latitude, location.longitude);
        LocalDateTime local;
        try {
            local = LocalDateTime.of(r.getYear(), r.getMonth(), r.getDate(), r.getHour(), r.getMinute(),
                    r.getSecond() == null ? 0 : r.getSecond());
        } catch (DateTimeException e) {
            throw new InputDomainException("Invalid birth date or time: " + e.getMessage());
        }
        ZoneId zone = TimezoneUtils.resolveZone(r.getTimezoneId(), location.latitude, location.longitude);
        Instant instant = local.atZone(zone).toInstant();
        return new BirthMoment(instant, JulianDay.fromInstant(instant), zone, location);
    }

    private static LocalDate civilDate(JyotishRequest r) {
        try {
            return LocalDate.of(r.getYear(), r.getMonth(), r.getDate());
        } catch (DateTimeException e) {
            throw new InputDomainException("Invalid date: " + e.getMessage());
        }
    }

    private static VimshottariDashaService.BalanceMode balanceMode(String value) {
        if (value == null || value.isBlank()) {
            return VimshottariDashaService.BalanceMode.PROPORTIONAL;
        }
        try {
            return VimshottariDashaService.BalanceMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InputDomainException("Unknown dasha balance mode: " + value);
        }
    }

    // =========================================================================
    // JSON shaping
    // =========================================================================

    private static Map<String, Object> positionJson(ChartPosition position) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("sign", position.sign.index());
        json.put("signName", position.sign.getDisplayName());
        json.put("degreeInSign", position.degreeInSign);
        json.put("house", position.house);
        json.put("division", position.division);
        json.put("retrograde", position.retrograde);
        return json;
    }

    private static Map<String, Object> nakshatraJson(double longitude) {
        NakshatraPlacement placement = SignUtils.nakshatraOf(longitude);
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("nakshatra", placement.asNakshatra().getDisplayName());
        json.put("nakshatraLord", placement.asNakshatra().lord().getDisplayName());
        json.put("pada", placement.pada);
        return json;
    }

    private Map<String, Object> panchangaJson(Panchanga p) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("date", p.date.toString());
        json.put("timezone", p.zone.getId());
        json.put("sunrise", time(p.sunriseJd, p.zone));
        json.put("sunset", time(p.sunsetJd, p.zone));
        json.put("nextSunrise", time(p.nextSunriseJd, p.zone));

        Map<String, Object> vara = new LinkedHashMap<>();
        vara.put("name", p.vara.getDisplayName());
        vara.put("sanskritName", p.vara.getSanskritName());
        vara.put("lord", p.vara.getLord().getDisplayName());
        json.put("vara", vara);

        Map<String, Object> tithi = elementJson(p.tithi, p.zone);
        tithi.put("paksha", p.paksha.getDisplayName());
        json.put("tithi", tithi);

        Map<String, Object> nakshatra = elementJson(p.nakshatra, p.zone);
        nakshatra.put("pada", p.nakshatraPada);
        json.put("nakshatra", nakshatra);
        json.put("yoga", elementJson(p.yoga, p.zone));

        List<Map<String, Object>> karanas = new ArrayList<>();
        for (KaranaSpan karana : p.karanas) {
            Map<String, Object> k = new LinkedHashMap<>();
            k.put("slot", karana.slot);
            k.put("name", karana.name);
            k.put("endTime", time(karana.endJd, p.zone));
            karanas.add(k);
        }
        json.put("karanas", karanas);

        Map<String, Object> month = new LinkedHashMap<>();
        month.put("amantaMonth", p.lunarMonth.amantaName);
        month.put("purnimantaMonth", p.lunarMonth.purnimantaName);
        month.put("isAdhikaMasa", p.lunarMonth.adhikaMasa);
        month.put("amantaStart", time(p.lunarMonth.amantaStartJd, p.zone));
        month.put("amantaEnd", time(p.lunarMonth.amantaEndJd, p.zone));
        month.put("purnimantaStart", time(p.lunarMonth.purnimantaStartJd, p.zone));
        month.put("purnimantaEnd", time(p.lunarMonth.purnimantaEndJd, p.zone));
        json.put("lunarMonth", month);

        json.put("sunSign", p.sunSign.getDisplayName());
        json.put("moonSign", p.moonSign.getDisplayName());

        Map<String, Object> samvat = new LinkedHashMap<>();
        samvat.put("shaka", p.shakaSamvat);
        samvat.put("vikram", p.vikramSamvat);
        samvat.put("gujarati", p.gujaratiSamvat);
        json.put("samvat", samvat);
        return json;
    }

    private static Map<String, Object> elementJson(PanchangaElement element, ZoneId zone) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("index", element.currentValue);
        json.put("name", element.currentName);
        json.put("startTime", time(element.currentStartJd, zone));
        json.put("endTime", time(element.currentEndJd, zone));
        json.put("nextIndex", element.nextValue);
        json.put("nextName", element.nextName);
        json.put("nextEndTime", time(element.nextEndJd, zone));
        return json;
    }

    private static List<Map<String, Object>> intervalsJson(List<DashaInterval> intervals, ZoneId zone) {
        List<Map<String, Object>> json = new ArrayList<>();
        for (DashaInterval interval : intervals) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("lord", interval.lord.getDisplayName());
            entry.put("level", interval.level.getDisplayName());
            entry.put("start", format(interval.start, zone));
            entry.put("end", format(interval.end, zone));
            if (!interval.children.isEmpty()) {
                entry.put("children", intervalsJson(interval.children, zone));
            }
            json.add(entry);
        }
        return json;
    }

    private static String time(double julianDay, ZoneId zone) {
        return format(JulianDay.toInstant(julianDay), zone);
    }

    private static String format(Instant instant, ZoneId zone) {
        return instant.truncatedTo(ChronoUnit.SECONDS).atZone(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static final class BirthMoment {
        final Instant instant;
        final double julianDay;
        final ZoneId zone;
        final GeoLocation location;

        BirthMoment(Instant instant, double julianDay, ZoneId zone, GeoLocation location) {
            this.instant = instant;
            this.julianDay = julianDay;
            this.zone = zone;
            this.location = location;
        }
    }
}
