package vn.com.fecredit.fileportal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.fileportal.exception.AccountExistsException;
import vn.com.fecredit.fileportal.model.Account;
import vn.com.fecredit.fileportal.model.AccountRepository;
import vn.com.fecredit.fileportal.model.AccountView;
import vn.com.fecredit.fileportal.model.ProfileUpdateRequest;
import vn.com.fecredit.fileportal.model.RegisterRequest;

import java.time.Clock;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public AccountView register(RegisterRequest request) {
        String username = request.getUsername().trim();
        if (accountRepository.existsByUsername(username)) {
            throw new AccountExistsException(username);
        }
        Account account = new Account();
        account.setUsername(username);
        account.setEmail(request.getEmail());
        account.setPassword(passwordEncoder.encode(request.getPassword()));
        account.setCreatedAt(clock.instant());
        try {
            account = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new AccountExistsException(username, e);
        }
        log.info("Registered account {}", username);
        return toView(account);
    }

    public AccountView findByUsername(String username) {
        return toView(load(username));
    }

    /**
     * Changes the email and/or password of the caller. A blank email clears it.
     */
    @Transactional
    public AccountView updateProfile(String username, ProfileUpdateRequest request) {
        if (request.getEmail() == null && request.getPassword() == null) {
            throw new IllegalArgumentException("Nothing to update");
        }
        Account account = load(username);
        if (request.getEmail() != null) {
            account.setEmail(request.getEmail().isBlank() ? null : request.getEmail().trim());
        }
        if (request.getPassword() != null) {
            account.setPassword(passwordEncoder.encode(request.getPassword()));
        }
        log.info("Updated profile of {}{}", username, request.getPassword() != null ? " (password changed)" : "");
        return toView(accountRepository.save(account));
    }

    private Account load(String username) {
        return accountRepository.findByUsername(username)
                .orElseThrow(() -> new IllegalStateException("Authenticated account not found: " + username));
    }

    private static AccountView toView(Account account) {
        return new AccountView(account.getId(), account.getUsername(), account.getEmail(), account.getCreatedAt());
    }
}
