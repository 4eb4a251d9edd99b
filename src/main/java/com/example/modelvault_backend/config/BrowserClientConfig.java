package com.example.modelvault_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RenderProperties.class)
public class BrowserClientConfig {

    @Bean("browserWebClient")
    public WebClient browserWebClient(RenderProperties props) {
        var sessionTimeout = Duration.ofSeconds(props.getSessionTimeoutSeconds());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // screenshots come back in one piece
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(sessionTimeout)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getBrowser().getConnectTimeoutMillis());

        return WebClient.builder()
                .baseUrl(props.getBrowser().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .build();
    }
}
