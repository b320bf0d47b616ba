package com.vet.clinic.auth;

import com.vet.clinic.exception.AccessDeniedException;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Who is calling and in which role. Built once per request at the web boundary
 * and handed to every ledger operation; the engine never looks up a current user.
 */
public record AccessContext(String identity, Role role) {

    public AccessContext {
        Objects.requireNonNull(role, "role");
        if (StringUtils.isBlank(identity)) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        identity = identity.trim();
    }

    public static AccessContext owner(String email) {
        return new AccessContext(email, Role.OWNER);
    }

    public static AccessContext staff(String identity) {
        return new AccessContext(identity, Role.STAFF);
    }

    public static AccessContext clinician(String identity) {
        return new AccessContext(identity, Role.CLINICIAN);
    }

    public boolean isOwner() {
        return role == Role.OWNER;
    }

    /** Owners match appointments by contact email, case-insensitive. */
    public boolean ownsContact(String email) {
        return StringUtils.equalsIgnoreCase(identity, StringUtils.trim(email));
    }

    public void requireClinicTeam(String action) {
        if (isOwner()) {
            throw new AccessDeniedException("Only clinic staff may " + action + ".");
        }
    }

    public void requireOwnerOf(String email, String action) {
        if (isOwner() && !ownsContact(email)) {
            throw new AccessDeniedException("Owner " + identity + " may not " + action + " for another owner's appointment.");
        }
    }
}
