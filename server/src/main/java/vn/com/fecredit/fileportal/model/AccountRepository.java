package vn.com.fecredit.fileportal.model;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Account lookups used by authentication and registration.
 */
public interface AccountRepository extends JpaRepository<Account, Long> {
    Optional<Account> findByUsername(String username);

    boolean existsByUsername(String username);
}
