package com.example.intake.config;

import com.example.intake.properties.ApplicationProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp Client Configuration
 *
 * Shared connection pool and dispatcher for the identity provider and access log clients.
 * Neither client retries: a repeated send means a second email or SMS.
 */
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool sharedConnectionPool(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(),
                              TimeUnit.MINUTES);
  }

  /**
   * Shared dispatcher, also used for asynchronous access log delivery
   */
  @Bean
  public Dispatcher sharedDispatcher(ApplicationProperties properties) {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(properties.http().client().maxRequests());
    dispatcher.setMaxRequestsPerHost(properties.http().client().maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Identity provider client. The call timeout bounds the whole exchange so a stalled
   * provider can never hang a request.
   */
  @Bean(name = "identityProviderOkHttpClient")
  public OkHttpClient identityProviderOkHttpClient(ApplicationProperties properties,
                                                   ConnectionPool connectionPool,
                                                   Dispatcher dispatcher) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.readTimeout())
        .callTimeout(client.callTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }

  /**
   * Fast client for best-effort telemetry
   */
  @Bean(name = "accessLogOkHttpClient")
  public OkHttpClient accessLogOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(1, TimeUnit.SECONDS)
        .readTimeout(2, TimeUnit.SECONDS)
        .writeTimeout(2, TimeUnit.SECONDS)
        .callTimeout(3, TimeUnit.SECONDS)
        .retryOnConnectionFailure(false)
        .build();
  }
}
