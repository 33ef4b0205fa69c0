package com.revenueplatform.marketdata.client;

import com.revenueplatform.common.model.ComparableFilters;
import com.revenueplatform.common.model.MarketData;
import com.revenueplatform.common.model.MarketSample;
import com.revenueplatform.marketdata.model.KeyDataKpiResponse;
import com.revenueplatform.marketdata.model.MonthlyKpiSummary;
import com.revenueplatform.marketdata.model.WeeklyKpiSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Key Data market KPI client.
 *
 * <p>A market sample combines two requests issued together:
 * <pre>
 *   POST /api/v1/ota/market/kpis/month   previous calendar month  → RevPAR, occupancy, ADR, peak ADR
 *   POST /api/v1/ota/market/kpis/week    today … today + 60 days  → forward occupancy and ADR
 * </pre>
 * Key Data has no percentile endpoint, so the 20th-percentile ADR is approximated as
 * 65% of the average ADR.
 */
public class KeyDataWebClient {

    private static final Logger log = LoggerFactory.getLogger(KeyDataWebClient.class);

    static final String MONTHLY_PATH = "/api/v1/ota/market/kpis/month";
    static final String WEEKLY_PATH  = "/api/v1/ota/market/kpis/week";

    private static final double P20_OF_AVG_ADR      = 0.65;
    private static final double PEAK_OF_FUTURE_ADR  = 1.4;
    private static final int    FORWARD_WINDOW_DAYS = 60;
    private static final int    DAYS_PER_YEAR       = 365;

    private final WebClient webClient;
    private final String apiKey;
    private final Clock clock;

    public KeyDataWebClient(WebClient keyDataWebClient, String apiKey, Clock clock) {
        this.webClient = keyDataWebClient;
        this.apiKey    = apiKey;
        this.clock     = clock;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Fetches and aggregates one comparable sample.
     *
     * @param filters {@code null} for the whole market
     */
    public Mono<MarketSample> fetchMarketSample(String marketId, ComparableFilters filters) {
        LocalDate today     = LocalDate.now(clock);
        LocalDate histStart = today.minusMonths(1).withDayOfMonth(1);
        LocalDate histEnd   = today.withDayOfMonth(1).minusDays(1);

        log.info("Fetching market sample. provider=KeyData marketId={} filters={}", marketId, filters);

        return Mono.zip(
                fetchMonthlyKpis(marketId, histStart, histEnd, filters),
                fetchWeeklyKpis(marketId, today, today.plusDays(FORWARD_WINDOW_DAYS), filters))
            .map(t -> toSample(t.getT1(), t.getT2()))
            .doOnSuccess(s -> log.info("Market sample fetched. provider=KeyData marketId={} dataPoints={}",
                marketId, s.dataPoints()))
            .doOnError(e -> log.error("Key Data fetch failed. marketId={}", marketId, e));
    }

    public Mono<MonthlyKpiSummary> fetchMonthlyKpis(String marketId, LocalDate start, LocalDate end,
                                                   ComparableFilters filters) {
        return post(MONTHLY_PATH, requestBody(marketId, start, end, filters))
            .map(r -> summarizeMonthly(r.kpisOrEmpty()));
    }

    public Mono<WeeklyKpiSummary> fetchWeeklyKpis(String marketId, LocalDate start, LocalDate end,
                                                 ComparableFilters filters) {
        return post(WEEKLY_PATH, requestBody(marketId, start, end, filters))
            .map(r -> summarizeWeekly(r.kpisOrEmpty()));
    }

    private Mono<KeyDataKpiResponse> post(String path, Map<String, Object> body) {
        return webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .header("x-api-key", apiKey)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(KeyDataKpiResponse.class)
            .defaultIfEmpty(new KeyDataKpiResponse(null));
    }

    static Map<String, Object> requestBody(String marketId, LocalDate start, LocalDate end,
                                           ComparableFilters filters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("market_uuid", marketId);
        body.put("start_date", start.toString());
        body.put("end_date", end.toString());
        body.put("currency", "USD");
        Map<String, Object> apiFilters = apiFilters(filters);
        if (apiFilters != null) {
            body.put("filters", apiFilters);
        }
        return body;
    }

    /** Key Data filter object; {@code null} when nothing survives. */
    static Map<String, Object> apiFilters(ComparableFilters filters) {
        if (filters == null) return null;

        Map<String, Object> f = new LinkedHashMap<>();
        if (filters.ota() != null && !filters.ota().isBlank()) {
            f.put("ota", filters.ota());
        }
        if (filters.propertyType() != null && !filters.propertyType().isBlank()) {
            f.put("property_type", filters.propertyType().toLowerCase(Locale.ROOT));
        }
        if (filters.bedrooms() != null && filters.bedrooms() > 0) {
            f.put("bedrooms", filters.bedrooms());
        }
        if (filters.minSleeps() != null && filters.minSleeps() > 0) {
            f.put("min_sleeps", filters.minSleeps());
        }
        if (!filters.amenities().isEmpty()) {
            f.put("amenities", filters.amenities().stream()
                .map(a -> a.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "_"))
                .toList());
        }
        return f.isEmpty() ? null : f;
    }

    static MonthlyKpiSummary summarizeMonthly(List<KeyDataKpiResponse.Kpi> kpis) {
        double totalRevPAR = 0, totalOcc = 0, totalADR = 0, peakADR = 0;
        int n = 0;
        for (KeyDataKpiResponse.Kpi m : kpis) {
            n++;
            if (m.revpar() != null)         totalRevPAR += m.revpar();
            if (m.guestOccupancy() != null) totalOcc    += m.guestOccupancy();
            if (m.adr() != null) {
                totalADR += m.adr();
                peakADR = Math.max(peakADR, m.adr());
            }
        }
        double revPAR = n > 0 ? totalRevPAR / n : 0;
        return new MonthlyKpiSummary(
            revPAR,
            revPAR * DAYS_PER_YEAR,
            n > 0 ? totalOcc / n : 0,
            n > 0 ? totalADR / n : 0,
            peakADR,
            n);
    }

    static WeeklyKpiSummary summarizeWeekly(List<KeyDataKpiResponse.Kpi> kpis) {
        double totalOcc = 0, totalADR = 0, totalRevPAR = 0;
        int n = 0;
        for (KeyDataKpiResponse.Kpi w : kpis) {
            if (w.guestOccupancy() == null || w.adr() == null) continue;
            totalOcc    += w.guestOccupancy();
            totalADR    += w.adr();
            totalRevPAR += w.revpar() != null ? w.revpar() : 0;
            n++;
        }
        return new WeeklyKpiSummary(
            n > 0 ? totalOcc / n : 0,
            n > 0 ? totalADR / n : 0,
            n > 0 ? totalRevPAR / n : 0,
            n);
    }

    static MarketSample toSample(MonthlyKpiSummary monthly, WeeklyKpiSummary weekly) {
        double peak = monthly.peakADR() > 0 ? monthly.peakADR() : weekly.futureADR() * PEAK_OF_FUTURE_ADR;
        MarketData data = new MarketData(
            monthly.marketRevPAR(),
            monthly.avgOccupancy(),
            monthly.avgADR() * P20_OF_AVG_ADR,
            peak,
            weekly.futureADR(),
            monthly.annualRevPAR(),
            monthly.avgADR(),
            null,
            weekly.dataPoints() > 0 ? weekly.occupancy() : null);
        return new MarketSample(data, monthly.dataPoints() + weekly.dataPoints());
    }
}
