package com.socialhub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.SocialUser;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * User lookups. Every finder fetches the role eagerly because callers compare role levels
 * outside of a persistence context (security filters).
 */
public interface UserRepository extends JpaRepository<SocialUser, UUID> {

    @EntityGraph(attributePaths = "role")
    @Query("select u from SocialUser u where u.id = :id")
    Optional<SocialUser> findWithRoleById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "role")
    Optional<SocialUser> findByUsername(String username);

    @EntityGraph(attributePaths = "role")
    @Query("select u from SocialUser u where lower(u.email) = lower(:email)")
    Optional<SocialUser> findByEmailIgnoreCase(@Param("email") String email);

    /**
     * Username match wins over email match, so an identifier never resolves to two rows.
     */
    default Optional<SocialUser> findByIdentifier(String identifier) {
        Optional<SocialUser> byUsername = findByUsername(identifier);
        return byUsername.isPresent() ? byUsername : findByEmailIgnoreCase(identifier);
    }

    // compares across both columns: a new username may not equal an existing email and vice versa
    @Query("""
            select case when count(u) > 0 then true else false end
              from SocialUser u
             where u.username = :username
                or u.username = :email
                or lower(u.email) = lower(:email)
                or lower(u.email) = lower(:username)
            """)
    boolean existsByUsernameOrEmail(@Param("username") String username, @Param("email") String email);

    @EntityGraph(attributePaths = "role")
    Optional<SocialUser> findByPasswordResetToken(String passwordResetToken);

    @EntityGraph(attributePaths = "role")
    Optional<SocialUser> findByActivationToken(String activationToken);

    @EntityGraph(attributePaths = "role")
    @Query(value = "select u from SocialUser u where u.timeoutUntil > :now",
            countQuery = "select count(u) from SocialUser u where u.timeoutUntil > :now")
    Page<SocialUser> findTimedOutUsers(@Param("now") OffsetDateTime now, Pageable pageable);
}
