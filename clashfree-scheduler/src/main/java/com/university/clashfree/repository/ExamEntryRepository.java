package com.university.clashfree.repository;

import com.university.clashfree.model.ExamEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExamEntryRepository extends JpaRepository<ExamEntry, Long> {

    List<ExamEntry> findByCycleIdOrderByDayIndexAscStartPeriodAscExamIdAsc(String cycleId);
}
