package com.socialhub.backend.modules.auth.application;

import com.socialhub.backend.modules.auth.domain.SocialUser;

/**
 * Outcome of one step of the login chain. A step that cannot decide returns
 * {@link #notApplicable()} and the next step runs.
 *
 * @param user   resolved account, {@code null} when not applicable
 * @param issued tokens that must be written as cookies, {@code null} when the existing ones stay
 */
public record LoginAttempt(SocialUser user, TokenPair issued) {

    private static final LoginAttempt NOT_APPLICABLE = new LoginAttempt(null, null);

    public static LoginAttempt resolved(SocialUser user, TokenPair issued) {
        return new LoginAttempt(user, issued);
    }

    public static LoginAttempt notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean isResolved() {
        return user != null;
    }
}
