package com.example.interviewreminder.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the mail service
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final MailServiceProperties mailServiceProperties;

    @Bean(name = "mailServiceWebClient")
    public WebClient mailServiceWebClient(WebClient.Builder builder) {
        return createWebClient(builder, mailServiceProperties.getBaseUrl(), mailServiceProperties.getTimeoutSeconds(), "MailService");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Service-Name", "interview-reminder")
                .filter(logRequest(serviceName))
                .filter(logResponse(serviceName))
                .build();
    }

    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
