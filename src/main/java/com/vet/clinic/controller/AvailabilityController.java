package com.vet.clinic.controller;

import com.vet.clinic.auth.AccessContext;
import com.vet.clinic.dto.AvailabilityProfileRequest;
import com.vet.clinic.dto.SlotView;
import com.vet.clinic.entity.AvailabilityProfile;
import com.vet.clinic.service.AvailabilityService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/availability")
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping("/{staffMember}")
    public ResponseEntity<AvailabilityProfile> getProfile(@PathVariable String staffMember) {
        return ResponseEntity.ok(availabilityService.getProfile(staffMember));
    }

    @GetMapping("/{staffMember}/slots")
    public ResponseEntity<List<SlotView>> slots(
            @PathVariable String staffMember,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(availabilityService.slots(staffMember, date));
    }

    @PutMapping("/{staffMember}")
    public ResponseEntity<AvailabilityProfile> upsertProfile(AccessContext ctx,
                                                             @PathVariable String staffMember,
                                                             @RequestBody AvailabilityProfileRequest request) {
        return ResponseEntity.ok(availabilityService.upsertProfile(ctx, staffMember, request));
    }
}
