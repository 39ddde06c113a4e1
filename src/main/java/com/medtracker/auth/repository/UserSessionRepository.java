package com.medtracker.auth.repository;

import com.medtracker.auth.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for UserSession entity.
 */
@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {
}
