package in.co.kitree.jyotish.pojos;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Full panchanga for one civil day at one place. Instants are Julian Days (UT).
 */
public final class Panchanga {

    public final LocalDate date;
    public final ZoneId zone;
    public final GeoLocation location;
    public final double sunriseJd;
    public final double sunsetJd;
    public final double nextSunriseJd;
    public final Vara vara;
    public final PanchangaElement tithi;
    public final Paksha paksha;
    public final PanchangaElement nakshatra;
    public final int nakshatraPada;
    public final PanchangaElement yoga;
    public final List<KaranaSpan> karanas;
    public final LunarMonth lunarMonth;
    public final Sign sunSign;
    public final Sign moonSign;
    public final int shakaSamvat;
    public final int vikramSamvat;
    public final int gujaratiSamvat;

    private Panchanga(Builder b) {
        this.date = b.date;
        this.zone = b.zone;
        this.location = b.location;
        this.sunriseJd = b.sunriseJd;
        this.sunsetJd = b.sunsetJd;
        this.nextSunriseJd = b.nextSunriseJd;
        this.vara = b.vara;
        this.tithi = b.tithi;
        this.paksha = b.paksha;
        this.nakshatra = b.nakshatra;
        this.nakshatraPada = b.nakshatraPada;
        this.yoga = b.yoga;
        this.karanas = List.copyOf(b.karanas);
        this.lunarMonth = b.lunarMonth;
        this.sunSign = b.sunSign;
        this.moonSign = b.moonSign;
        this.shakaSamvat = b.shakaSamvat;
        this.vikramSamvat = b.vikramSamvat;
        this.gujaratiSamvat = b.gujaratiSamvat;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LocalDate date;
        private ZoneId zone;
        private GeoLocation location;
        private double sunriseJd;
        private double sunsetJd;
        private double nextSunriseJd;
        private Vara vara;
        private PanchangaElement tithi;
        private Paksha paksha;
        private PanchangaElement nakshatra;
        private int nakshatraPada;
        private PanchangaElement yoga;
        private List<KaranaSpan> karanas = List.of();
        private LunarMonth lunarMonth;
        private Sign sunSign;
        private Sign moonSign;
        private int shakaSamvat;
        private int vikramSamvat;
        private int gujaratiSamvat;

        private Builder() {}

        public Builder date(LocalDate date, ZoneId zone) {
            this.date = date;
            this.zone = zone;
            return this;
        }

        public Builder location(GeoLocation location) {
            this.location = location;
            return this;
        }

        public Builder sun(double sunriseJd, double sunsetJd, double nextSunriseJd) {
            this.sunriseJd = sunriseJd;
            this.sunsetJd = sunsetJd;
            this.nextSunriseJd = nextSunriseJd;
            return this;
        }

        public Builder vara(Vara vara) {
            this.vara = vara;
            return this;
        }

        public Builder tithi(PanchangaElement tithi, Paksha paksha) {
            this.tithi = tithi;
            this.paksha = paksha;
            return this;
        }

        public Builder nakshatra(PanchangaElement nakshatra, int pada) {
            this.nakshatra = nakshatra;
            this.nakshatraPada = pada;
            return this;
        }

        public Builder yoga(PanchangaElement yoga) {
            this.yoga = yoga;
            return this;
        }

        public Builder karanas(List<KaranaSpan> karanas) {
            this.karanas = karanas;
            return this;
        }

        public Builder lunarMonth(LunarMonth lunarMonth) {
            this.lunarMonth = lunarMonth;
            return this;
        }

        public Builder signs(Sign sunSign, Sign moonSign) {
            this.sunSign = sunSign;
            this.moonSign = moonSign;
            return this;
        }

        public Builder samvat(int shaka, int vikram, int gujarati) {
            this.shakaSamvat = shaka;
            this.vikramSamvat = vikram;
            this.gujaratiSamvat = gujarati;
            return this;
        }

        public Panchanga build() {
            return new Panchanga(this);
        }
    }
}
