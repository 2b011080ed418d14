package com.socialhub.backend.modules.auth.application;

import com.socialhub.backend.modules.auth.domain.SocialUser;

/**
 * An account together with the emailed link produced for it. {@code link} may be {@code null}
 * when no account matched.
 */
public record AccountLink(SocialUser user, String link) {
}
