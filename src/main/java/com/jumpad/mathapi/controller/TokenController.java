package com.jumpad.mathapi.controller;

import com.jumpad.mathapi.model.TokenResponse;
import com.jumpad.mathapi.security.Role;
import com.jumpad.mathapi.service.TokenService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public credential issuance endpoints.
 *
 * <p>Each endpoint issues a credential for a fixed identity; which role the
 * credential carries depends only on the endpoint called. Any request body is
 * ignored.</p>
 */
@RestController
public class TokenController {

    private final TokenService tokenService;

    public TokenController(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @PostMapping(value = "/token_admin", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> issueAdminToken() {
        return ResponseEntity.ok(TokenResponse.bearer(tokenService.issue(Role.ADMINISTRATOR)));
    }

    @PostMapping(value = "/token_tester", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TokenResponse> issueTesterToken() {
        return ResponseEntity.ok(TokenResponse.bearer(tokenService.issue(Role.TESTER)));
    }
}
