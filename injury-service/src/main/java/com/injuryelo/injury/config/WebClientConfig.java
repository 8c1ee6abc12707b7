package com.injuryelo.injury.config;

import com.injuryelo.injury.client.EspnInjuryFeedClient;
import com.injuryelo.injury.client.InjuryFeedClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Bean
    public WebClient injuryFeedWebClient(WebClient.Builder builder, InjuryProperties properties) {
        InjuryProperties.Feed feed = properties.getFeed();
        long fetchTimeoutMs = properties.fetchTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, feed.getConnectTimeoutMs())
            .responseTimeout(properties.fetchTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(fetchTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(feed.getBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.USER_AGENT, feed.getUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public InjuryFeedClient injuryFeedClient(WebClient injuryFeedWebClient, InjuryProperties properties, Clock clock) {
        return new EspnInjuryFeedClient(injuryFeedWebClient, properties.fetchTimeout(), clock);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
