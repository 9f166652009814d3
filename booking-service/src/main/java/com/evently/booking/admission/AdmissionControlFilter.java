package com.evently.booking.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Waiting room gate for show and booking routes. Deferred clients get 429 with an estimated wait.
 */
@Slf4j
@RequiredArgsConstructor
public class AdmissionControlFilter extends OncePerRequestFilter {

    private final AdmissionService admissionService;
    private final AdmissionProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !properties.isEnabled() || !AdmissionRoutes.isGated(AdmissionRoutes.path(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String clientId = AdmissionRoutes.resolveClientId(request);
        Long showId = AdmissionRoutes.resolveShowId(request);

        AdmissionDecision decision = admissionService.evaluate(clientId, showId);
        if (decision.isAdmitted()) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Deferred client={} show={} token={}", clientId, showId, decision.getQueueToken());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getEstimatedWaitSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), DeferredAdmissionResponse.from(decision));
    }
}
