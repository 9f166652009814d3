package com.evently.booking.config;

import com.evently.booking.admission.AdmissionControlFilter;
import com.evently.booking.admission.AdmissionProperties;
import com.evently.booking.admission.AdmissionService;
import com.evently.booking.admission.RateLimitFilter;
import com.evently.booking.admission.RateLimitService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the rate limiter and the waiting room in front of the API, rate limiter first.
 */
@Configuration
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionConfig {

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(RateLimitService rateLimitService,
                                                                   AdmissionProperties properties,
                                                                   ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
            new FilterRegistrationBean<>(new RateLimitFilter(rateLimitService, properties, objectMapper));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<AdmissionControlFilter> admissionControlFilter(AdmissionService admissionService,
                                                                                 AdmissionProperties properties,
                                                                                 ObjectMapper objectMapper) {
        FilterRegistrationBean<AdmissionControlFilter> registration =
            new FilterRegistrationBean<>(new AdmissionControlFilter(admissionService, properties, objectMapper));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
        return registration;
    }

    @Bean(name = "admissionWorkerExecutor")
    public ThreadPoolTaskExecutor admissionWorkerExecutor(AdmissionProperties properties) {
        int concurrency = Math.max(1, properties.getWorker().getConcurrency());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency);
        executor.setThreadNamePrefix("admission-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
