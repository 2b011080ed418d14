package com.socialhub.backend.modules.auth.application;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.SocialUser;

/**
 * Outcome of resolving one request's session cookies.
 *
 * @param user          resolved identity, {@code null} when no identity could be established
 * @param rotatedTokens fresh pair minted on the refresh path, {@code null} otherwise
 * @param rejection     why the request must stop, {@code null} on success
 */
public record SessionResolution(SocialUser user, TokenPair rotatedTokens, ProblemException rejection) {

    public static SessionResolution accepted(SocialUser user, TokenPair rotatedTokens) {
        return new SessionResolution(user, rotatedTokens, null);
    }

    public static SessionResolution rejected(SocialUser user, TokenPair rotatedTokens, ProblemException rejection) {
        return new SessionResolution(user, rotatedTokens, rejection);
    }

    public static SessionResolution rejected(ProblemException rejection) {
        return new SessionResolution(null, null, rejection);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public boolean isRotated() {
        return rotatedTokens != null;
    }
}
