package com.university.clashfree.repository;

import com.university.clashfree.model.SeatEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SeatEntryRepository extends JpaRepository<SeatEntry, Long> {

    List<SeatEntry> findByCycleIdOrderByExamIdAscRoomIdAscSeatLabelAsc(String cycleId);

    List<SeatEntry> findByCycleIdAndStudentIdOrderByExamIdAsc(String cycleId, String studentId);
}
