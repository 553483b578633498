package com.university.clashfree.repository;

import com.university.clashfree.model.InvigilationEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InvigilationEntryRepository extends JpaRepository<InvigilationEntry, Long> {

    List<InvigilationEntry> findByCycleIdOrderByDayIndexAscStartPeriodAscExamIdAsc(String cycleId);

    List<InvigilationEntry> findByCycleIdAndFacultyIdOrderByDayIndexAscStartPeriodAsc(String cycleId, String facultyId);
}
