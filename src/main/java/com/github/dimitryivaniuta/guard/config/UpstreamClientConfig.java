package com.github.dimitryivaniuta.guard.config;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamClient;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamFailureClassifier;
import com.github.dimitryivaniuta.guard.proxy.upstream.WebClientUpstreamClient;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class UpstreamClientConfig {

    private final UpstreamGuardProperties props;

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder) {
        // connect timeout only; the overall deadline is the TimeLimiter below
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, props.getRequestTimeout().toMillis()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(props.getMaxResponseBytes()))
                .build();

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean
    public TimeLimiter upstreamTimeLimiter() {
        return TimeLimiter.of("upstream", TimeLimiterConfig.custom()
                .timeoutDuration(props.getRequestTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    @Bean
    public UpstreamClient upstreamClient(WebClient upstreamWebClient,
                                         TimeLimiter upstreamTimeLimiter,
                                         ScheduledExecutorService guardScheduler,
                                         UpstreamFailureClassifier classifier,
                                         UpstreamGuardMetrics metrics) {
        log.info("Upstream client: baseUrl={}, timeout={}ms, maxResponseBytes={}",
                props.getBaseUrl(), props.getRequestTimeout().toMillis(), props.getMaxResponseBytes());
        return new WebClientUpstreamClient(upstreamWebClient, props.getBaseUrl(), upstreamTimeLimiter,
                guardScheduler, classifier, metrics);
    }
}
