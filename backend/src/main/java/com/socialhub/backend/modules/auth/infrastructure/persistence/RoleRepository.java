package com.socialhub.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    Optional<Role> findByLevel(int level);
}
