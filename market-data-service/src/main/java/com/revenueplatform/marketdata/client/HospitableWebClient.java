package com.revenueplatform.marketdata.client;

import com.revenueplatform.common.model.PropertyData;
import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.marketdata.model.CalendarStats;
import com.revenueplatform.marketdata.model.HospitableCalendarDay;
import com.revenueplatform.marketdata.model.HospitableProperty;
import com.revenueplatform.marketdata.model.HospitableReservation;
import com.revenueplatform.marketdata.model.HospitableResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Hospitable property-management client.
 *
 * <p>{@link #fetchPropertyData(String)} issues four requests together:
 * <ol>
 *   <li>calendar for the last six full months: RevPAR, occupancy, ADR</li>
 *   <li>calendar from the same month last year: lowest sold nightly rate</li>
 *   <li>property details: current base price</li>
 *   <li>reservations: average booking length</li>
 * </ol>
 */
public class HospitableWebClient {

    private static final Logger log = LoggerFactory.getLogger(HospitableWebClient.class);

    private static final String PER_PAGE = "100";

    private static final ParameterizedTypeReference<HospitableResponse<List<HospitableProperty>>> PROPERTIES =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<HospitableResponse<HospitableProperty>> PROPERTY =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<HospitableResponse<List<HospitableCalendarDay>>> CALENDAR =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<HospitableResponse<List<HospitableReservation>>> RESERVATIONS =
        new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final String apiKey;
    private final Clock clock;

    public HospitableWebClient(WebClient hospitableWebClient, String apiKey, Clock clock) {
        this.webClient = hospitableWebClient;
        this.apiKey    = apiKey;
        this.clock     = clock;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    // ── properties ───────────────────────────────────────────────────────────

    public Mono<List<PropertySummary>> listProperties() {
        return webClient.get()
            .uri(b -> b.path("/properties").queryParam("per_page", PER_PAGE).build())
            .headers(h -> h.setBearerAuth(apiKey))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(PROPERTIES)
            .map(r -> r.data() == null ? List.<HospitableProperty>of() : r.data())
            .defaultIfEmpty(List.of())
            .map(list -> list.stream()
                .filter(HospitableProperty::isActive)
                .map(p -> new PropertySummary(p.effectiveId(), p.name() != null ? p.name() : "Unnamed",
                    p.effectivePrice()))
                .toList())
            .doOnSuccess(l -> log.info("Properties listed. provider=Hospitable count={}", l.size()));
    }

    public Mono<Double> fetchCurrentPrice(String propertyId) {
        return webClient.get()
            .uri("/properties/{id}", propertyId)
            .headers(h -> h.setBearerAuth(apiKey))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(PROPERTY)
            .map(r -> r.data() == null ? 0.0 : r.data().effectivePrice())
            .defaultIfEmpty(0.0);
    }

    // ── calendar ─────────────────────────────────────────────────────────────

    public Mono<CalendarStats> fetchCalendarStats(String propertyId, LocalDate start, LocalDate end) {
        return webClient.get()
            .uri(b -> b.path("/properties/{id}/calendar")
                .queryParam("start_date", start.toString())
                .queryParam("end_date", end.toString())
                .build(propertyId))
            .headers(h -> h.setBearerAuth(apiKey))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(CALENDAR)
            .map(r -> calendarStats(r.data()))
            .defaultIfEmpty(CalendarStats.EMPTY);
    }

    static CalendarStats calendarStats(List<HospitableCalendarDay> days) {
        if (days == null || days.isEmpty()) {
            return CalendarStats.EMPTY;
        }

        double totalRevenue = 0;
        double lowestSold = Double.MAX_VALUE;
        int booked = 0;
        int blocked = 0;

        for (HospitableCalendarDay day : days) {
            if (!day.isUnavailable()) continue;
            if (day.hasReservation()) {
                booked++;
                double nightly = day.nightlyAmount();
                totalRevenue += nightly;
                if (nightly > 0 && nightly < lowestSold) {
                    lowestSold = nightly;
                }
            } else {
                blocked++;
            }
        }

        int available = days.size() - blocked;
        return new CalendarStats(
            available > 0 ? totalRevenue / available : 0,
            available > 0 ? (double) booked / available : 0,
            booked > 0 ? totalRevenue / booked : 0,
            lowestSold == Double.MAX_VALUE ? 0 : lowestSold,
            totalRevenue,
            booked,
            available);
    }

    // ── reservations ─────────────────────────────────────────────────────────

    public Mono<Double> fetchAvgBookingLength(String propertyId) {
        return webClient.get()
            .uri(b -> b.path("/reservations").queryParam("per_page", PER_PAGE).build())
            .headers(h -> h.setBearerAuth(apiKey))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(RESERVATIONS)
            .map(r -> averageBookingLength(r.data(), propertyId))
            .defaultIfEmpty(0.0);
    }

    /** Mean nights over the property's non-cancelled reservations; 0 when none qualify. */
    static double averageBookingLength(List<HospitableReservation> reservations, String propertyId) {
        if (reservations == null) return 0;

        int totalNights = 0;
        int count = 0;
        for (HospitableReservation r : reservations) {
            if (!r.belongsTo(propertyId) || r.isCancelled()) continue;

            long nights = r.nights() != null && r.nights() > 0 ? r.nights() : nightsBetween(r);
            if (nights > 0) {
                totalNights += nights;
                count++;
            }
        }
        return count > 0 ? (double) totalNights / count : 0;
    }

    private static long nightsBetween(HospitableReservation r) {
        if (r.arrival() == null || r.departure() == null) return 0;
        try {
            return ChronoUnit.DAYS.between(parseDate(r.arrival()), parseDate(r.departure()));
        } catch (RuntimeException e) {
            log.debug("Skipping reservation with unparseable dates. arrival={} departure={}",
                r.arrival(), r.departure());
            return 0;
        }
    }

    private static LocalDate parseDate(String value) {
        return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
    }

    // ── aggregate ────────────────────────────────────────────────────────────

    public Mono<PropertyData> fetchPropertyData(String propertyId) {
        LocalDate today     = LocalDate.now(clock);
        LocalDate histStart = today.minusMonths(6).withDayOfMonth(1);
        LocalDate histEnd   = today.withDayOfMonth(1).minusDays(1);
        LocalDate yearStart = today.minusYears(1).withDayOfMonth(1);

        log.info("Fetching property data. provider=Hospitable propertyId={}", propertyId);

        return Mono.zip(
                fetchCalendarStats(propertyId, histStart, histEnd),
                fetchCalendarStats(propertyId, yearStart, histEnd),
                fetchCurrentPrice(propertyId),
                fetchAvgBookingLength(propertyId))
            .map(t -> toPropertyData(t.getT1(), t.getT2(), t.getT3(), t.getT4()))
            .doOnSuccess(p -> log.info("Property data fetched. provider=Hospitable propertyId={} occupancy={} revPAR={}",
                propertyId, String.format("%.3f", p.myOccupancy()), String.format("%.2f", p.myRevPAR())))
            .doOnError(e -> log.error("Hospitable fetch failed. propertyId={}", propertyId, e));
    }

    static PropertyData toPropertyData(CalendarStats recent, CalendarStats lastYear,
                                       double currentPrice, double avgBookingLength) {
        return new PropertyData(
            recent.revPAR(),
            recent.occupancy(),
            lastYear.lowestSoldPrice() > 0 ? lastYear.lowestSoldPrice() : recent.lowestSoldPrice(),
            currentPrice > 0 ? currentPrice : recent.adr(),
            recent.adr(),
            avgBookingLength > 0 ? avgBookingLength : null);
    }
}
