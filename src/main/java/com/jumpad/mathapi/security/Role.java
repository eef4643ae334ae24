package com.jumpad.mathapi.security;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles a credential can carry.
 *
 * <p>Both roles are allowed to call the compute endpoints; the role is recorded
 * in the credential and in logs but does not restrict operations.</p>
 */
public enum Role {

    ADMINISTRATOR("admin"),
    TESTER("tester");

    /**
     * Name of the claim holding the role inside a credential.
     */
    public static final String CLAIM = "nivel_acesso";

    private final String claimValue;

    Role(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /**
     * Spring Security authority granted to a principal with this role.
     */
    public String authority() {
        return "ROLE_" + name();
    }

    /**
     * Resolves a role from its claim value.
     *
     * @param claimValue the value found in the credential
     * @return the matching role, or empty when unknown
     */
    public static Optional<Role> fromClaim(String claimValue) {
        return Arrays.stream(values())
            .filter(role -> role.claimValue.equals(claimValue))
            .findFirst();
    }
}
