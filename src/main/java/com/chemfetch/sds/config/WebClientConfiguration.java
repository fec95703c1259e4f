package com.chemfetch.sds.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration RESPONSE_TIMEOUT = Duration.ofMinutes(3);

    private static final int MAX_IN_MEMORY = 4 * 1024 * 1024;

    /**
     * Prototype builder for the JSON clients (search API, remote extraction
     * service). Each client supplies its own base URL and per-call timeout;
     * the response timeout here is only the outer bound.
     *
     * @param mapper    the scraper {@link ObjectMapper}
     * @param httpProps shared outbound HTTP settings
     * @return a pre-configured {@link WebClient.Builder}
     */
    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("scraperObjectMapper") final ObjectMapper mapper,
                                              final HttpProperties httpProps) {

        /* --- JSON codecs wired to the custom ObjectMapper ------------------ */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY);
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("sds-pool")
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofMillis(2000))
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) httpProps.getConnectTimeout().toMillis())
                .responseTimeout(RESPONSE_TIMEOUT)
                .followRedirect(true)
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, httpProps.getUserAgent())
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    /**
     * Shared JDK client for HTML pages, PDF probes and downloads. Redirects are
     * never followed automatically: callers walk them so the hop count stays
     * bounded and the final URL is known.
     *
     * @param httpProps shared outbound HTTP settings
     * @return the shared {@link java.net.http.HttpClient}
     */
    @Bean
    public java.net.http.HttpClient scraperHttpClient(final HttpProperties httpProps) {
        return java.net.http.HttpClient.newBuilder()
                .followRedirects(java.net.http.HttpClient.Redirect.NEVER)
                .connectTimeout(httpProps.getConnectTimeout())
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().contentType().orElse(null));
            return Mono.just(res);
        });
    }
}
