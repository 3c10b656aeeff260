package com.carelink.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

    @Query("select u from User u where lower(u.email) = lower(:email)")
    Optional<User> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from User u
             where lower(u.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from User u
             where u.resetPasswordToken = :token
               and u.resetPasswordExpires > :now
            """)
    Optional<User> findByValidResetToken(@Param("token") String token, @Param("now") OffsetDateTime now);

    @Query("""
            select u
              from User u
             where (:role is null or u.role = :role)
               and (:status is null or u.status = :status)
               and (:searchPattern is null or lower(u.email) like :searchPattern)
            """)
    Page<User> search(
            @Param("role") UserRole role,
            @Param("status") AccountStatus status,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );
}
