package com.socialhub.backend.modules.moderation.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Minimal access to posts and comments for moderation deletes.
 */
@Repository
public class ContentRepository {

    private final JdbcTemplate jdbcTemplate;

    public ContentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UUID> findCommentAuthor(UUID commentId) {
        List<UUID> authors = jdbcTemplate.query(
                "SELECT author_id FROM comments WHERE id = ?",
                (rs, rowNum) -> rs.getObject("author_id", UUID.class),
                commentId
        );
        return authors.stream().findFirst();
    }

    public Optional<UUID> findPostAuthor(UUID postId) {
        List<UUID> authors = jdbcTemplate.query(
                "SELECT author_id FROM posts WHERE id = ?",
                (rs, rowNum) -> rs.getObject("author_id", UUID.class),
                postId
        );
        return authors.stream().findFirst();
    }

    public int deleteComment(UUID commentId) {
        return jdbcTemplate.update("DELETE FROM comments WHERE id = ?", commentId);
    }

    public int deletePost(UUID postId) {
        return jdbcTemplate.update("DELETE FROM posts WHERE id = ?", postId);
    }

    public int deletePostsByAuthor(UUID authorId) {
        return jdbcTemplate.update("DELETE FROM posts WHERE author_id = ?", authorId);
    }
}
