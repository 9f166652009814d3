package com.evently.booking.admission;

import jakarta.servlet.http.HttpServletRequest;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Route classification and request identity shared by the admission filters.
 */
final class AdmissionRoutes {

    static final String CLIENT_ID_HEADER = "X-Client-Id";

    private static final List<String> GATED_PREFIXES = List.of("/api/v1/shows", "/api/v1/bookings");
    private static final List<String> BYPASS_PREFIXES = List.of(
        "/api/v1/bookings/health", "/api/v1/admin", "/actuator", "/swagger-ui", "/v3/api-docs");

    private static final Pattern SHOW_PATH = Pattern.compile("^/api/v1/shows/(\\d+)(/.*)?$");

    private AdmissionRoutes() {
    }

    static boolean isBypassed(String path) {
        return BYPASS_PREFIXES.stream().anyMatch(path::startsWith);
    }

    static boolean isGated(String path) {
        return !isBypassed(path) && GATED_PREFIXES.stream().anyMatch(path::startsWith);
    }

    /**
     * Lock, confirm and cancel calls
     */
    static boolean isBookingOperation(String path) {
        return path.endsWith("/lock") || path.endsWith("/confirm") || path.endsWith("/cancel");
    }

    static String path(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    static String resolveClientId(HttpServletRequest request) {
        String header = request.getHeader(CLIENT_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "unknown";
    }

    /**
     * Show id from a /api/v1/shows/{showId} path, else the showId parameter; null when neither is present.
     */
    static Long resolveShowId(HttpServletRequest request) {
        Matcher matcher = SHOW_PATH.matcher(path(request));
        if (matcher.matches()) {
            return parseShowId(matcher.group(1));
        }
        String param = request.getParameter("showId");
        return param != null ? parseShowId(param.trim()) : null;
    }

    /**
     * Ids that do not fit a long are not a show; the request falls back to the system-wide counter.
     */
    private static Long parseShowId(String value) {
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
