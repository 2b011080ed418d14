package com.socialhub.backend.modules.auth.domain;

import com.socialhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Role row: a numeric level (1 normal, 2 moderator, 3 admin) plus a free-text description.
 */
@Entity
@Table(name = "roles")
public class Role extends AbstractTimestampedEntity {

    @Column(name = "level", nullable = false, unique = true)
    private int level;

    @Column(name = "description", nullable = false)
    private String description;

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
