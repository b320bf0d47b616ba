package com.vet.clinic.repository;

import com.vet.clinic.entity.ConsumptionLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

public interface ConsumptionLineRepository extends JpaRepository<ConsumptionLine, Long> {

    @Query("SELECT l FROM ConsumptionLine l JOIN FETCH l.appointment WHERE l.deductionStatus = :status")
    List<ConsumptionLine> findWithAppointmentByStatus(@Param("status") ConsumptionLine.DeductionStatus status);

    @Query("SELECT l FROM ConsumptionLine l JOIN FETCH l.appointment "
            + "WHERE l.itemName = :itemName AND l.deductionStatus = :status")
    List<ConsumptionLine> findWithAppointmentByItemNameAndStatus(@Param("itemName") String itemName,
                                                                 @Param("status") ConsumptionLine.DeductionStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ConsumptionLine l WHERE l.id = :id")
    Optional<ConsumptionLine> findByIdForUpdate(@Param("id") Long id);
}
