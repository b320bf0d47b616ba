package com.vet.clinic.repository;

import com.vet.clinic.entity.AvailabilityProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AvailabilityProfileRepository extends JpaRepository<AvailabilityProfile, Long> {
    Optional<AvailabilityProfile> findByStaffMember(String staffMember);
}
