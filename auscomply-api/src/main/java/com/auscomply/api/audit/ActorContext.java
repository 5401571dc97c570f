package com.auscomply.api.audit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Who triggered an operation and from where, supplied by the calling request layer.
 */
public record ActorContext(String actorUserId, String ipAddress, String userAgent) {

    public static final String ACTOR_HEADER = "X-Actor-ID";
    public static final String UNKNOWN_IP = "unknown";

    public ActorContext {
        if (actorUserId == null || actorUserId.isBlank()) {
            actorUserId = "anonymous";
        }
        if (ipAddress == null || ipAddress.isBlank()) {
            ipAddress = UNKNOWN_IP;
        }
    }

    public static ActorContext from(HttpServletRequest request) {
        return new ActorContext(
                request.getHeader(ACTOR_HEADER),
                clientIp(request),
                request.getHeader("User-Agent"));
    }

    /**
     * Context for work started by the system itself, e.g. a scheduled job.
     */
    public static ActorContext system(String component) {
        return new ActorContext("system:" + component, "127.0.0.1", "auscomply-jobs");
    }

    /**
     * First address in X-Forwarded-For, then X-Real-IP, then the socket address.
     */
    public static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
