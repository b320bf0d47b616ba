package com.vet.clinic.auth;

import com.vet.clinic.exception.AccessDeniedException;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessContextTest {

    @Test
    void roleAliasesFromFrontEnd() {
        assertThat(Role.parse("Vet")).contains(Role.CLINICIAN);
        assertThat(Role.parse("veterinarian")).contains(Role.CLINICIAN);
        assertThat(Role.parse("clinicStaff")).contains(Role.STAFF);
        assertThat(Role.parse(" owner ")).contains(Role.OWNER);
        assertThat(Role.parse("admin")).isEmpty();
        assertThat(Role.parse(null)).isEmpty();
    }

    @Test
    void roleParsingIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(Role.parse("CLINICIAN")).contains(Role.CLINICIAN);
            assertThat(Role.parse("VETERINARIAN")).contains(Role.CLINICIAN);
            assertThat(Role.parse("CLINIC_STAFF")).contains(Role.STAFF);
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void ownerMatchesContactIgnoringCase() {
        AccessContext owner = AccessContext.owner(" Ana@Example.com ");

        assertThat(owner.identity()).isEqualTo("Ana@Example.com");
        assertThat(owner.ownsContact("ana@example.com")).isTrue();
        assertThatCode(() -> owner.requireOwnerOf("ana@example.com", "view")).doesNotThrowAnyException();
        assertThatThrownBy(() -> owner.requireOwnerOf("ben@example.com", "view"))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> owner.requireClinicTeam("approve"))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessageContaining("approve");
    }

    @Test
    void clinicTeamActsOnAnyAppointment() {
        AccessContext staff = AccessContext.staff("front-desk@clinic");

        assertThatCode(() -> staff.requireOwnerOf("ben@example.com", "view")).doesNotThrowAnyException();
        assertThatCode(() -> staff.requireClinicTeam("approve")).doesNotThrowAnyException();
    }

    @Test
    void blankIdentityIsRefused() {
        assertThatThrownBy(() -> new AccessContext("  ", Role.STAFF)).isInstanceOf(IllegalArgumentException.class);
    }
}
