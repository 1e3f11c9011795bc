package vn.com.fecredit.fileportal.controller;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import vn.com.fecredit.fileportal.model.AccountView;
import vn.com.fecredit.fileportal.model.ProfileUpdateRequest;
import vn.com.fecredit.fileportal.model.RegisterRequest;
import vn.com.fecredit.fileportal.service.AccountService;

import java.security.Principal;

@RestController
@RequestMapping("/api/auth")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping("/register")
    public ResponseEntity<AccountView> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.register(request));
    }

    @GetMapping("/me")
    public ResponseEntity<AccountView> me(Principal principal) {
        return ResponseEntity.ok(accountService.findByUsername(principal.getName()));
    }

    @PutMapping("/me")
    public ResponseEntity<AccountView> updateMe(@Valid @RequestBody ProfileUpdateRequest request, Principal principal) {
        return ResponseEntity.ok(accountService.updateProfile(principal.getName(), request));
    }
}
