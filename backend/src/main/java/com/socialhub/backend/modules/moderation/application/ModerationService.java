package com.socialhub.backend.modules.moderation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.global.security.SessionPrincipal;
import com.socialhub.backend.modules.auth.domain.SocialUser;
import com.socialhub.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.socialhub.backend.modules.moderation.domain.ModerationAction;
import com.socialhub.backend.modules.moderation.domain.TimeoutDuration;
import com.socialhub.backend.modules.moderation.infrastructure.ContentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moderation mutations. Every method resolves the target first, then asks
 * {@link PermissionPolicy}, then mutates.
 */
@Service
@Transactional
public class ModerationService {

    static final int TIMED_OUT_PAGE_SIZE = 10;
    private static final int NO_TARGET_LEVEL = 0;

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    private final UserRepository userRepository;
    private final ContentRepository contentRepository;
    private final PermissionPolicy permissionPolicy;
    private final Clock clock;

    public ModerationService(
            UserRepository userRepository,
            ContentRepository contentRepository,
            PermissionPolicy permissionPolicy,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.contentRepository = contentRepository;
        this.permissionPolicy = permissionPolicy;
        this.clock = clock;
    }

    public SocialUser timeoutUser(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId, String durationLabel) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.TIMEOUT);
        TimeoutDuration duration = TimeoutDuration.fromLabel(durationLabel)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "bad_request.invalid_timeout_duration",
                        "timeoutDuration must be one of 30m, 1h, 6h, 12h, 1d"));
        target.setTimeoutUntil(OffsetDateTime.now(clock).plus(duration.duration()));
        log.info("user {} timed out user {} for {}", actor.userId(), targetUserId, duration.label());
        return target;
    }

    public SocialUser removeTimeout(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.REMOVE_TIMEOUT);
        target.setTimeoutUntil(null);
        log.info("user {} removed timeout of user {}", actor.userId(), targetUserId);
        return target;
    }

    @Transactional(readOnly = true)
    public List<SocialUser> listTimedOutUsers(@NonNull SessionPrincipal actor, int page) {
        permissionPolicy.require(actor.roleLevel(), NO_TARGET_LEVEL, ModerationAction.LIST_TIMED_OUT);
        if (page < 1) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "bad_request.invalid_page", "page must be 1 or greater");
        }
        PageRequest pageRequest = PageRequest.of(page - 1, TIMED_OUT_PAGE_SIZE, Sort.by(Sort.Direction.ASC, "timeoutUntil"));
        return userRepository.findTimedOutUsers(OffsetDateTime.now(clock), pageRequest).getContent();
    }

    public SocialUser deactivateUser(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.DEACTIVATE);
        target.setActive(false);
        log.info("user {} deactivated user {}", actor.userId(), targetUserId);
        return target;
    }

    public SocialUser activateUser(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.ACTIVATE);
        target.setActive(true);
        log.info("user {} activated user {}", actor.userId(), targetUserId);
        return target;
    }

    /**
     * Bans the target and deletes their posts in the same transaction.
     */
    public SocialUser banUser(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.BAN);
        target.setBanned(true);
        target.setActive(false);
        userRepository.flush();
        int deletedPosts = contentRepository.deletePostsByAuthor(targetUserId);
        log.info("user {} banned user {} and removed {} posts", actor.userId(), targetUserId, deletedPosts);
        return target;
    }

    public SocialUser unbanUser(@NonNull SessionPrincipal actor, @NonNull UUID targetUserId) {
        SocialUser target = authorizeOnUser(actor, targetUserId, ModerationAction.UNBAN);
        target.setBanned(false);
        log.info("user {} unbanned user {}", actor.userId(), targetUserId);
        return target;
    }

    public void deleteComment(@NonNull SessionPrincipal actor, @NonNull UUID commentId) {
        contentRepository.findCommentAuthor(commentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "not_found.comment", "comment not found"));
        permissionPolicy.require(actor.roleLevel(), NO_TARGET_LEVEL, ModerationAction.DELETE_COMMENT);
        contentRepository.deleteComment(commentId);
        log.info("user {} deleted comment {}", actor.userId(), commentId);
    }

    public void deletePost(@NonNull SessionPrincipal actor, @NonNull UUID postId) {
        contentRepository.findPostAuthor(postId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "not_found.post", "post not found"));
        permissionPolicy.require(actor.roleLevel(), NO_TARGET_LEVEL, ModerationAction.DELETE_POST);
        contentRepository.deletePost(postId);
        log.info("user {} deleted post {}", actor.userId(), postId);
    }

    private SocialUser authorizeOnUser(SessionPrincipal actor, UUID targetUserId, ModerationAction action) {
        SocialUser target = userRepository.findWithRoleById(targetUserId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "not_found.user", "user not found"));
        permissionPolicy.require(actor.roleLevel(), target.getRoleLevel(), action);
        return target;
    }
}
