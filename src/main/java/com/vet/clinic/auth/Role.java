package com.vet.clinic.auth;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

public enum Role {
    OWNER,
    CLINICIAN,
    STAFF;

    /**
     * Accepts the role names the front end has used over time
     * ("vet", "veterinarian", "clinicStaff", ...), case-insensitive.
     */
    public static Optional<Role> parse(String raw) {
        if (StringUtils.isBlank(raw)) return Optional.empty();
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "owner":
                return Optional.of(OWNER);
            case "clinician":
            case "vet":
            case "veterinarian":
                return Optional.of(CLINICIAN);
            case "staff":
            case "clinicstaff":
            case "clinic_staff":
                return Optional.of(STAFF);
            default:
                return Optional.empty();
        }
    }
}
