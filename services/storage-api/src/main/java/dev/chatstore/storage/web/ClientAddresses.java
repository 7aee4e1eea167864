package dev.chatstore.storage.web;

import jakarta.servlet.http.HttpServletRequest;

final class ClientAddresses {

    private ClientAddresses() {
    }

    /**
     * First hop of {@code X-Forwarded-For}, then {@code X-Real-IP}, then the socket peer.
     */
    static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return remote == null ? "unknown" : remote;
    }
}
