package com.conduit.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for HTTP requests to upstream providers. The response timeout is
 * applied per call by {@link com.conduit.client.PlatformHttpClient} so that a reload can change it.
 */
@Configuration
public class WebClientConfiguration {

    private final ConduitProperties properties;

    public WebClientConfiguration(ConduitProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) properties.getHttp().getConnectTimeout().toMillis());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getHttp().getMaxInMemorySize()))
                .build();
    }
}
