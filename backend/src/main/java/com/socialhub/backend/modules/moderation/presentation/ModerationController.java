package com.socialhub.backend.modules.moderation.presentation;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.security.SecurityUtils;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;
import com.socialhub.backend.modules.moderation.application.ModerationService;
import com.socialhub.backend.modules.moderation.presentation.dto.MessageResponse;
import com.socialhub.backend.modules.moderation.presentation.dto.ModerationResponse;
import com.socialhub.backend.modules.moderation.presentation.dto.TimedOutUsersResponse;
import com.socialhub.backend.modules.moderation.presentation.dto.TimeoutRequest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/action")
public class ModerationController {

    private final ModerationService moderationService;

    public ModerationController(ModerationService moderationService) {
        this.moderationService = moderationService;
    }

    @PostMapping("/timeout/{userId}")
    public ResponseEntity<ModerationResponse> timeoutUser(
            @PathVariable("userId") UUID userId,
            @RequestBody(required = false) TimeoutRequest request
    ) {
        String duration = request != null ? request.timeoutDuration() : null;
        UserResponse user = UserResponse.from(
                moderationService.timeoutUser(SecurityUtils.getCurrentPrincipal(), userId, duration));
        return ResponseEntity.ok(new ModerationResponse("User Timed Out Successfully", user));
    }

    @DeleteMapping("/timeout/{userId}")
    public ResponseEntity<ModerationResponse> removeTimeout(@PathVariable("userId") UUID userId) {
        UserResponse user = UserResponse.from(
                moderationService.removeTimeout(SecurityUtils.getCurrentPrincipal(), userId));
        return ResponseEntity.ok(new ModerationResponse("User Timeout Removed Successfully", user));
    }

    @GetMapping("/timeout")
    public ResponseEntity<TimedOutUsersResponse> listTimedOutUsers(
            @RequestParam(name = "page", defaultValue = "1") int page
    ) {
        List<UserResponse> users = moderationService.listTimedOutUsers(SecurityUtils.getCurrentPrincipal(), page)
                .stream()
                .map(UserResponse::from)
                .toList();
        return ResponseEntity.ok(new TimedOutUsersResponse("Timed Out Users Fetched Successfully", page, users));
    }

    @DeleteMapping("/deactivate/{userId}")
    public ResponseEntity<ModerationResponse> deactivateUser(@PathVariable("userId") UUID userId) {
        UserResponse user = UserResponse.from(
                moderationService.deactivateUser(SecurityUtils.getCurrentPrincipal(), userId));
        return ResponseEntity.ok(new ModerationResponse("User Deactivated Successfully", user));
    }

    @PostMapping("/activate/{userId}")
    public ResponseEntity<ModerationResponse> activateUser(@PathVariable("userId") UUID userId) {
        UserResponse user = UserResponse.from(
                moderationService.activateUser(SecurityUtils.getCurrentPrincipal(), userId));
        return ResponseEntity.ok(new ModerationResponse("User Activated Successfully", user));
    }

    @PostMapping("/ban/{userId}")
    public ResponseEntity<ModerationResponse> banUser(@PathVariable("userId") UUID userId) {
        UserResponse user = UserResponse.from(
                moderationService.banUser(SecurityUtils.getCurrentPrincipal(), userId));
        return ResponseEntity.ok(new ModerationResponse("User Banned Successfully", user));
    }

    @PostMapping("/unban/{userId}")
    public ResponseEntity<ModerationResponse> unbanUser(@PathVariable("userId") UUID userId) {
        UserResponse user = UserResponse.from(
                moderationService.unbanUser(SecurityUtils.getCurrentPrincipal(), userId));
        return ResponseEntity.ok(new ModerationResponse("User Unbanned Successfully", user));
    }

    @DeleteMapping("/comment/{commentId}")
    public ResponseEntity<MessageResponse> deleteComment(@PathVariable("commentId") UUID commentId) {
        moderationService.deleteComment(SecurityUtils.getCurrentPrincipal(), commentId);
        return ResponseEntity.ok(new MessageResponse("Comment Deleted Successfully"));
    }

    @DeleteMapping("/post/{postId}")
    public ResponseEntity<MessageResponse> deletePost(@PathVariable("postId") UUID postId) {
        moderationService.deletePost(SecurityUtils.getCurrentPrincipal(), postId);
        return ResponseEntity.ok(new MessageResponse("Post Deleted Successfully"));
    }
}
