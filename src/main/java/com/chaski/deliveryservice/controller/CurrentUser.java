package com.chaski.deliveryservice.controller;

import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the caller's identity from the validated JWT.
 */
final class CurrentUser {

    static final String USER_ID_CLAIM = "user_id";
    static final String OPERATOR_AUTHORITY = "ROLE_OPERATOR";

    private CurrentUser() {
    }

    /**
     * The {@code user_id} claim, or the subject when the token has none.
     */
    static Long id(Jwt jwt) {
        Object claim = jwt.getClaim(USER_ID_CLAIM);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        String raw = claim != null ? claim.toString() : jwt.getSubject();
        try {
            return Long.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Token does not carry a numeric user id", e);
        }
    }

    static boolean isOperator(Authentication authentication) {
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> OPERATOR_AUTHORITY.equals(authority.getAuthority()));
    }
}
