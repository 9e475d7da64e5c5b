/**
 * Configuration for the outbound HTTP client
 * - Defines the WebClient used to fetch preview pages
 * - Sets request timeouts and idle-connection reuse limits
 */
package net.linkpreview.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import net.linkpreview.util.ApplicationConstants;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - One connection pool shared by every page fetch for the life of the process
 * - Bodies are streamed by the fetcher, so no in-memory codec limit is relied on
 */
@Configuration
public class WebClientConfig {

    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(90);
    private static final Duration EVICTION_INTERVAL = Duration.ofSeconds(30);

    /**
     * Connection pool for page fetches
     * - Pool size is Reactor Netty's default, so concurrent fetches to one host rarely queue
     * - Idle connections are closed after 90 seconds by a background sweep
     * - Requests beyond the pool size queue for a free connection instead of failing fast
     *
     * @return the shared connection provider
     */
    @Bean(destroyMethod = "dispose")
    public ConnectionProvider pageFetchConnectionProvider() {
        return ConnectionProvider.builder(ApplicationConstants.Fetch.CONNECTION_POOL_NAME)
            .maxConnections(ConnectionProvider.DEFAULT_POOL_MAX_CONNECTIONS)
            .pendingAcquireMaxCount(-1)
            .pendingAcquireTimeout(ApplicationConstants.Fetch.REQUEST_TIMEOUT)
            .maxIdleTime(MAX_IDLE_TIME)
            .evictInBackground(EVICTION_INTERVAL)
            .build();
    }

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connect, read, write and response timeouts all set to the request timeout (10 seconds)
     * - Follows redirects
     * - Sends a desktop browser User-Agent
     *
     * @param pageFetchConnectionProvider pool shared by all page fetches
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(ConnectionProvider pageFetchConnectionProvider) {
        long timeoutMillis = ApplicationConstants.Fetch.REQUEST_TIMEOUT.toMillis();
        HttpClient httpClient = HttpClient.create(pageFetchConnectionProvider)
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(ApplicationConstants.Fetch.REQUEST_TIMEOUT);

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, ApplicationConstants.Fetch.USER_AGENT)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    /**
     * The single WebClient used by the page fetcher.
     *
     * @param webClientBuilder configured builder
     * @return shared WebClient
     */
    @Bean
    public WebClient pageFetchWebClient(WebClient.Builder webClientBuilder) {
        return webClientBuilder.build();
    }
}
