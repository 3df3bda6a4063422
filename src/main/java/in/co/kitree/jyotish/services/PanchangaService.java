package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.GeoLocation;
import in.co.kitree.jyotish.pojos.KaranaSpan;
import in.co.kitree.jyotish.pojos.LunarMonth;
import in.co.kitree.jyotish.pojos.Panchanga;
import in.co.kitree.jyotish.pojos.PanchangaElement;
import in.co.kitree.jyotish.pojos.PanchangaElementKind;
import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.Vara;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Panchanga for a civil day: exact transition instants of tithi, nakshatra, yoga and karana, plus the
 * lunar month and leap-month flag.
 *
 * <p>Every element is the one active at local sunrise. All instants are Julian Days (UT).</p>
 */
public class PanchangaService {

    public static final double KARANA_SPAN = 6.0;
    public static final int KARANAS_PER_MONTH = 60;
    // a civil day holds at most five karanas
    private static final int MAX_KARANAS_PER_DAY = 8;

    private static final double NEW_MOON = 0.0;
    private static final double FULL_MOON = 180.0;

    private final EphemerisAdapter ephemeris;
    private final SunriseProvider sunriseProvider;
    private final EngineSettings settings;
    private final BoundarySearch search;

    private final DoubleUnaryOperator elongation;
    private final DoubleUnaryOperator moonLongitude;
    private final DoubleUnaryOperator yogaSum;

    public PanchangaService(EphemerisAdapter ephemeris, SunriseProvider sunriseProvider, EngineSettings settings) {
        this.ephemeris = ephemeris;
        this.sunriseProvider = sunriseProvider;
        this.settings = settings;
        this.search = new BoundarySearch(settings);
        this.elongation = jd -> SignUtils.normalize(moon(jd) - sun(jd));
        this.moonLongitude = this::moon;
        this.yogaSum = jd -> SignUtils.normalize(sun(jd) + moon(jd));
    }

    public Panchanga compute(LocalDate date, ZoneId zone, GeoLocation location) {
        SignUtils.requireGeoLocation(location.latitude, location.longitude);
        long start = LoggingService.logOperationStart("panchanga_compute", Map.of(
                "date", date.toString(), "zone", zone.getId(),
                "latitude", location.latitude, "longitude", location.longitude));

        double sunrise = sunriseProvider.sunrise(date, location);
        double sunset = sunriseProvider.sunset(date, location);
        double nextSunrise = sunriseProvider.sunrise(date.plusDays(1), location);
        if (!(sunrise < nextSunrise)) {
            throw new InputDomainException(String.format(
                    "Sunrise JD %.6f is not before next sunrise JD %.6f", sunrise, nextSunrise));
        }

        PanchangaElement tithi = element(PanchangaElementKind.TITHI, sunrise);
        PanchangaElement nakshatra = element(PanchangaElementKind.NAKSHATRA, sunrise);
        PanchangaElement yoga = element(PanchangaElementKind.YOGA, sunrise);
        double moonAtSunrise = moon(sunrise);

        int year = date.getYear();
        Panchanga panchanga = Panchanga.builder()
                .date(date, zone)
                .location(location)
                .sun(sunrise, sunset, nextSunrise)
                .vara(Vara.of(date.getDayOfWeek()))
                .tithi(tithi, PanchangaNames.pakshaOf(tithi.currentValue))
                .nakshatra(nakshatra, SignUtils.nakshatraOf(moonAtSunrise).pada)
                .yoga(yoga)
                .karanas(karanas(sunrise, nextSunrise))
                .lunarMonth(lunarMonth(sunrise))
                .signs(Sign.of(SignUtils.signIndex(sun(sunrise))), Sign.of(SignUtils.signIndex(moonAtSunrise)))
                .samvat(year - 78, year + 57, year + 56)
                .build();

        LoggingService.logOperationEnd("panchanga_compute", start);
        return panchanga;
    }

    /**
     * The element active at {@code jd}, its own start and end, and the one that follows it.
     */
    public PanchangaElement element(PanchangaElementKind kind, double jd) {
        DoubleUnaryOperator f = functionFor(kind);
        double span = kind.getSpanDegrees();
        double window = settings.getBoundaryBracketDays();

        int current = indexOf(f.applyAsDouble(jd), span, kind.getCount());
        double start = search.findPrevious(f, SignUtils.normalize(current * span), jd, window);
        double end = search.findNext(f, SignUtils.normalize((current + 1) * span), jd, window);

        double probe = end + 2 * search.getToleranceDays();
        int next = indexOf(f.applyAsDouble(probe), span, kind.getCount());
        double nextEnd = search.findNext(f, SignUtils.normalize((next + 1) * span), probe, window);

        LoggingService.debug("panchanga_element_resolved", Map.of(
                "kind", kind.name(), "current", current, "start", start, "end", end, "next", next));
        return PanchangaElement.of(kind, current, PanchangaNames.nameOf(kind, current), start, end,
                next, PanchangaNames.nameOf(kind, next), nextEnd);
    }

    /**
     * Karanas from the one active at sunrise through the first one still running at the next sunrise.
     * End instants are the real transition times and may fall after {@code nextSunriseJd}.
     */
    public List<KaranaSpan> karanas(double sunriseJd, double nextSunriseJd) {
        List<KaranaSpan> spans = new ArrayList<>();
        int slot = indexOf(elongation.applyAsDouble(sunriseJd), KARANA_SPAN, KARANAS_PER_MONTH);
        double from = sunriseJd;
        while (spans.size() < MAX_KARANAS_PER_DAY) {
            double end = search.findNext(elongation, SignUtils.normalize((slot + 1) * KARANA_SPAN), from,
                    settings.getBoundaryBracketDays());
            spans.add(KaranaSpan.of(slot, karanaName(slot), end));
            if (end >= nextSunriseJd) {
                break;
            }
            slot = (slot + 1) % KARANAS_PER_MONTH;
            from = end;
        }
        return spans;
    }

    /**
     * Slot 0 and the last three slots of the month are fixed; slots 1-56 cycle the seven movable names.
     */
    public String karanaName(int slot) {
        List<String> fixed = settings.getKaranaFixedNames();
        if (slot == 0) {
            return fixed.get(0);
        }
        if (slot >= KARANAS_PER_MONTH - 3) {
            return fixed.get(slot - (KARANAS_PER_MONTH - 4));
        }
        return settings.getKaranaMovableNames().get((slot - 1) % 7);
    }

    /**
     * Lunar month holding {@code jd}.
     *
     * <p>Each reckoning is named from the Sun's sign at the syzygy that ends it. The month is Adhika when the
     * Sun is in the same sign at both new moons bounding the Amanta month, and then it carries the name of
     * the month before it.</p>
     */
    public LunarMonth lunarMonth(double jd) {
        double window = settings.getSyzygySearchDays();
        double step = settings.getSyzygyScanStepDays();
        double amantaStart = search.findPrevious(elongation, NEW_MOON, jd, window, step);
        double amantaEnd = search.findNext(elongation, NEW_MOON, jd, window, step);
        double purnimantaStart = search.findPrevious(elongation, FULL_MOON, jd, window, step);
        double purnimantaEnd = search.findNext(elongation, FULL_MOON, jd, window, step);

        int sunSignAtStart = SignUtils.signIndex(sun(amantaStart));
        int sunSignAtEnd = SignUtils.signIndex(sun(amantaEnd));
        boolean adhika = sunSignAtStart == sunSignAtEnd;
        List<String> names = settings.getMonthNames();

        LunarMonth month = LunarMonth.of(
                names.get(sunSignAtEnd),
                names.get(SignUtils.signIndex(sun(purnimantaEnd))),
                adhika, amantaStart, amantaEnd, purnimantaStart, purnimantaEnd);
        if (adhika) {
            LoggingService.info("adhika_masa_detected", Map.of(
                    "month", month.amantaName, "startJd", amantaStart, "endJd", amantaEnd));
        }
        return month;
    }

    private DoubleUnaryOperator functionFor(PanchangaElementKind kind) {
        switch (kind) {
            case TITHI:
                return elongation;
            case NAKSHATRA:
                return moonLongitude;
            case YOGA:
                return yogaSum;
            default:
                throw new IllegalArgumentException("Unknown panchanga element: " + kind);
        }
    }

    private static int indexOf(double angle, double span, int count) {
        return Math.min((int) Math.floor(angle / span), count - 1);
    }

    private double sun(double jd) {
        return ephemeris.longitude(Planet.SUN, jd);
    }

    private double moon(double jd) {
        return ephemeris.longitude(Planet.MOON, jd);
    }
}
