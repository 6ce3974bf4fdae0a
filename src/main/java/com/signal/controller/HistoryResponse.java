package com.signal.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signal.model.AnnotatedBar;
import com.signal.model.IndicatorValues;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * REST response DTO in TradingView history format, extended with indicator arrays.
 * Indicator entries are {@code null} where the indicator is not yet computable.
 *
 * <pre>
 * {
 *   "s": "ok",
 *   "t": [1620000000000, ...],
 *   "o": [1.10012, ...], "h": [...], "l": [...], "c": [...], "v": [...],
 *   "ema200": [...], "rsi": [...], "adx": [...], "atr": [...],
 *   "macd": [...], "macdSignal": [...], "macdHist": [...],
 *   "bbUpper": [...], "bbMiddle": [...], "bbLower": [...]
 * }
 * </pre>
 */
public record HistoryResponse(
        @JsonProperty("s") String status,
        @JsonProperty("tf") String timeframe,
        @JsonProperty("t") List<Long> times,
        @JsonProperty("o") List<Double> opens,
        @JsonProperty("h") List<Double> highs,
        @JsonProperty("l") List<Double> lows,
        @JsonProperty("c") List<Double> closes,
        @JsonProperty("v") List<Double> volumes,
        List<Double> ema200,
        List<Double> rsi,
        List<Double> adx,
        List<Double> atr,
        List<Double> macd,
        List<Double> macdSignal,
        List<Double> macdHist,
        List<Double> bbUpper,
        List<Double> bbMiddle,
        List<Double> bbLower
) {

    /**
     * Build a successful response from annotated bars sorted ascending.
     */
    public static HistoryResponse ok(String timeframe, List<AnnotatedBar> bars) {
        List<Long> t = new ArrayList<>();
        List<Double> o = new ArrayList<>();
        List<Double> h = new ArrayList<>();
        List<Double> l = new ArrayList<>();
        List<Double> c = new ArrayList<>();
        List<Double> v = new ArrayList<>();

        for (AnnotatedBar bar : bars) {
            t.add(bar.timestamp());
            o.add(round(bar.bar().open()));
            h.add(round(bar.bar().high()));
            l.add(round(bar.bar().low()));
            c.add(round(bar.bar().close()));
            v.add(bar.bar().volume());
        }

        return new HistoryResponse("ok", timeframe, t, o, h, l, c, v,
                column(bars, IndicatorValues::ema200),
                column(bars, IndicatorValues::rsi),
                column(bars, IndicatorValues::adx),
                column(bars, IndicatorValues::atr),
                column(bars, i -> i.macd() == null ? null : i.macd().line()),
                column(bars, i -> i.macd() == null ? null : i.macd().signal()),
                column(bars, i -> i.macd() == null ? null : i.macd().hist()),
                column(bars, i -> i.bollinger() == null ? null : i.bollinger().upper()),
                column(bars, i -> i.bollinger() == null ? null : i.bollinger().middle()),
                column(bars, i -> i.bollinger() == null ? null : i.bollinger().lower()));
    }

    /**
     * Build an empty successful response (no bars yet).
     */
    public static HistoryResponse noData(String timeframe) {
        return empty("no_data", timeframe);
    }

    /**
     * Build an error response.
     */
    public static HistoryResponse error(String message) {
        return empty("error: " + message, null);
    }

    private static HistoryResponse empty(String status, String timeframe) {
        return new HistoryResponse(status, timeframe,
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of());
    }

    private static List<Double> column(List<AnnotatedBar> bars, Function<IndicatorValues, Double> field) {
        List<Double> values = new ArrayList<>(bars.size());
        for (AnnotatedBar bar : bars) {
            Double value = field.apply(bar.indicators());
            values.add(value == null ? null : round(value));
        }
        return values;
    }

    private static double round(double value) {
        return Math.round(value * 100_000.0) / 100_000.0;
    }
}
