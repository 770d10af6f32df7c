package com.domogeek.calendarservice.config;

import com.domogeek.calendarservice.caldav.CaldavRestClient;
import com.domogeek.calendarservice.caldav.CaldavStartupValidator;
import com.domogeek.calendarservice.caldav.CalendarOverrideClient;
import com.domogeek.calendarservice.metrics.CalendarMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Remote calendar client, only when {@code calendar.caldav.url} is set.
 * <p>
 * Creating the client blocks until the server validates (see
 * {@link CaldavStartupValidator}), so the application is not ready before
 * the remote calendar is reachable.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("!'${calendar.caldav.url:}'.isBlank()")
public class CaldavConfig {

    @Bean
    public RestClient caldavRestClient(CalendarProperties properties) {
        CalendarProperties.Caldav caldav = properties.caldav();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(caldav.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(caldav.readTimeout());

        RestClient.Builder builder = RestClient.builder()
                .requestFactory(requestFactory);
        if (caldav.hasCredentials()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(caldav.username(),
                    caldav.password() != null ? caldav.password() : ""));
        }
        return builder.build();
    }

    @Bean
    public CaldavStartupValidator caldavStartupValidator(CalendarProperties properties, CalendarMetrics metrics) {
        return new CaldavStartupValidator(properties.startupRetry(), metrics);
    }

    @Bean
    public CalendarOverrideClient calendarOverrideClient(RestClient caldavRestClient,
                                                         CalendarMetrics metrics,
                                                         CaldavStartupValidator caldavStartupValidator,
                                                         CalendarProperties properties) {
        CalendarProperties.Caldav caldav = properties.caldav();
        CaldavRestClient client = new CaldavRestClient(caldavRestClient, metrics, caldav.url());

        log.info("Validating caldav server {} (path '{}')", caldav.url(), caldav.path());
        caldavStartupValidator.awaitReachable(client, caldav.path());
        return client;
    }
}
