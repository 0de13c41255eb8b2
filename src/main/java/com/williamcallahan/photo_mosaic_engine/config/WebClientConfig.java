/**
 * Configuration for WebClient
 * - Defines the shared WebClient builder used by listing sources and image downloads
 * - Sets up default timeouts and connection settings
 *
 * @author William Callahan
 */
package com.williamcallahan.photo_mosaic_engine.config;

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
 * - Follows redirects, since gallery links frequently point at CDN redirects
 * - Raises the in-memory buffer limit so full-size gallery images can be decoded
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts to 15 seconds
     * - Sets response timeout to 15 seconds
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(15, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(15));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(20 * 1024 * 1024)) // 20MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
