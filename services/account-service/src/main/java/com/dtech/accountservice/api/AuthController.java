package com.dtech.accountservice.api;

import com.dtech.accountservice.api.dto.LoginRequest;
import com.dtech.accountservice.api.dto.SessionTokenResponse;
import com.dtech.accountservice.domain.UserAccountService;
import com.dtech.security.JwtSessionTokenService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public endpoint issuing session tokens. */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final UserAccountService accounts;
    private final JwtSessionTokenService sessionTokens;

    public AuthController(UserAccountService accounts, JwtSessionTokenService sessionTokens) {
        this.accounts = accounts;
        this.sessionTokens = sessionTokens;
    }

    @PostMapping("/login")
    public SessionTokenResponse login(@Valid @RequestBody LoginRequest request) {
        String token = accounts.login(request.email(), request.password());
        return SessionTokenResponse.bearer(token, sessionTokens.expiry().toSeconds());
    }
}
