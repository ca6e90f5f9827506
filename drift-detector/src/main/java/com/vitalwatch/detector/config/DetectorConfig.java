package com.vitalwatch.detector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vitalwatch.common.model.DetectionConfig;
import com.vitalwatch.common.model.SignalThresholds;
import com.vitalwatch.detector.store.InfluxSampleStoreClient;
import com.vitalwatch.detector.store.PointWindow;
import com.vitalwatch.detector.store.SeriesWindow;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class DetectorConfig {

    // ── InfluxDB ──────────────────────────────────────────────────────────────
    @Value("${influxdb.url:http://influxdb:8086}")
    private String influxUrl;

    @Value("${influxdb.org:ld6002h}")
    private String influxOrg;

    @Value("${influxdb.token:}")
    private String influxToken;

    @Value("${influxdb.bucket:vitals_data}")
    private String influxBucket;

    // ── Judgment ──────────────────────────────────────────────────────────────
    @Value("${detector.heart-rate.abs-threshold:20}")
    private double hrAbs;

    @Value("${detector.heart-rate.rel-threshold:0.30}")
    private double hrRel;

    @Value("${detector.respiration.abs-threshold:5}")
    private double rrAbs;

    @Value("${detector.respiration.rel-threshold:0.35}")
    private double rrRel;

    @Value("${detector.trigger-threshold:3}")
    private int triggerThreshold;

    @Value("${detector.trim-window:10}")
    private int trimWindow;

    // ── Query windows ─────────────────────────────────────────────────────────
    @Value("${detector.series.lookback:12h}")
    private Duration seriesLookback;

    @Value("${detector.series.every:5m}")
    private Duration seriesEvery;

    @Value("${detector.series.period:10m}")
    private Duration seriesPeriod;

    @Value("${detector.point.lookback:2m}")
    private Duration pointLookback;

    @Value("${services.notification.base-url:http://localhost:8084}")
    private String notificationUrl;

    @Bean
    public DetectionConfig detectionConfig() {
        return new DetectionConfig(
            SignalThresholds.of(hrAbs, hrRel),
            SignalThresholds.of(rrAbs, rrRel),
            triggerThreshold,
            trimWindow);
    }

    @Bean
    public SeriesWindow seriesWindow() {
        return new SeriesWindow(seriesLookback, seriesEvery, seriesPeriod);
    }

    @Bean
    public PointWindow pointWindow() {
        return new PointWindow(pointLookback);
    }

    @Bean
    public WebClient influxWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(30))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(influxUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public InfluxSampleStoreClient sampleStoreClient(WebClient influxWebClient) {
        return new InfluxSampleStoreClient(influxWebClient, influxOrg, influxToken, influxBucket);
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(DetectorConfig.class)
                .debug("Outbound InfluxDB request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
