/**
 * Configuration for the WebClient used against the generative backend
 * - Defines the shared WebClient.Builder bean
 * - Sets connection, read and write timeouts sized for long SSE streams
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Ensures consistent HTTP client behavior across generation endpoints
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 5000ms
     * - Read and write idle timeouts derived from the stream timeout, since
     *   additional-details streams can stay open for most of a minute
     * - Response (first byte) timeout of 30 seconds
     *
     * @param properties application properties
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(AppConfigurationProperties properties) {
        long idleSeconds = Math.max(5, properties.getGeneration().getStreamTimeout().toSeconds());
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(idleSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(idleSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(30));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
