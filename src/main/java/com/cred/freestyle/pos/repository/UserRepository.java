package com.cred.freestyle.pos.repository;

import com.cred.freestyle.pos.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for User entity (read-only reference data).
 *
 * @author POS Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {
}
