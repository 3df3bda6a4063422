package in.co.kitree.jyotish.pojos;

import java.util.List;

public class JyotishRequest {
    private String function;

    // Optional caller correlation id; generated when absent
    private String requestId;

    // Civil date and time at the place of birth or observation
    private Integer date;
    private Integer month;
    private Integer year;
    private Integer hour;
    private Integer minute;
    private Integer second;
    private Double latitude;
    private Double longitude;

    // Optional; resolved from coordinates when absent
    private String timezoneId;

    // Divisional charts fields
    private List<Integer> divisionalChartNumbers;

    // Dasha fields
    private Integer dashaDepth;
    private Double dashaHorizonYears;
    private String dashaBalanceMode;

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Integer getDate() {
        return date;
    }

    public void setDate(Integer date) {
        this.date = date;
    }

    public Integer getMonth() {
        return month;
    }

    public void setMonth(Integer month) {
        this.month = month;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public Integer getHour() {
        return hour;
    }

    public void setHour(Integer hour) {
        this.hour = hour;
    }

    public Integer getMinute() {
        return minute;
    }

    public void setMinute(Integer minute) {
        this.minute = minute;
    }

    public Integer getSecond() {
        return second;
    }

    public void setSecond(Integer second) {
        this.second = second;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public String getTimezoneId() {
        return timezoneId;
    }

    public void setTimezoneId(String timezoneId) {
        this.timezoneId = timezoneId;
    }

    public List<Integer> getDivisionalChartNumbers() {
        return divisionalChartNumbers;
    }

    public void setDivisionalChartNumbers(List<Integer> divisionalChartNumbers) {
        this.divisionalChartNumbers = divisionalChartNumbers;
    }

    public Integer getDashaDepth() {
        return dashaDepth;
    }

    public void setDashaDepth(Integer dashaDepth) {
        this.dashaDepth = dashaDepth;
    }

    public Double getDashaHorizonYears() {
        return dashaHorizonYears;
    }

    public void setDashaHorizonYears(Double dashaHorizonYears) {
        this.dashaHorizonYears = dashaHorizonYears;
    }

    public String getDashaBalanceMode() {
        return dashaBalanceMode;
    }

    public void setDashaBalanceMode(String dashaBalanceMode) {
        this.dashaBalanceMode = dashaBalanceMode;
    }
}
