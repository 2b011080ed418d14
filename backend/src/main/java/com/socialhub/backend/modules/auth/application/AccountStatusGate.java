package com.socialhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.SocialUser;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Account-status checks applied after an identity is resolved. The first failing check wins:
 * banned, then inactive, then timed out.
 */
@Component
public class AccountStatusGate {

    private final Clock clock;

    public AccountStatusGate(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the rejection for {@code user}, or {@code null} when the account may proceed.
     */
    public ProblemException check(SocialUser user) {
        ProblemException loginRejection = checkLogin(user);
        if (loginRejection != null) {
            return loginRejection;
        }
        if (user.isTimedOut(OffsetDateTime.now(clock))) {
            return new ProblemException(HttpStatus.FORBIDDEN, "forbidden.account_timeout",
                    "account timeout until " + user.getTimeoutUntil());
        }
        return null;
    }

    /**
     * Login only looks at ban and activation; a timed-out user may still sign in.
     */
    public ProblemException checkLogin(SocialUser user) {
        if (user.isBanned()) {
            return new ProblemException(HttpStatus.FORBIDDEN, "forbidden.account_banned", "account banned");
        }
        if (!user.isActive()) {
            return new ProblemException(HttpStatus.FORBIDDEN, "forbidden.account_not_active", "account not active");
        }
        return null;
    }
}
