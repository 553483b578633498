package com.university.clashfree.repository;

import com.university.clashfree.model.TimetableEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TimetableRepository extends JpaRepository<TimetableEntry, Long> {

    List<TimetableEntry> findByCycleIdOrderByDayIndexAscStartPeriodAscSessionIdAsc(String cycleId);

    List<TimetableEntry> findByCycleIdAndFacultyIdOrderByDayIndexAscStartPeriodAsc(String cycleId, String facultyId);

    List<TimetableEntry> findByCycleIdAndRoomIdOrderByDayIndexAscStartPeriodAsc(String cycleId, String roomId);

    List<TimetableEntry> findByCycleIdAndDayOrderByStartPeriodAscSessionIdAsc(String cycleId, String day);

    @Query("select e from TimetableEntry e join e.studentIds s "
            + "where e.cycleId = :cycleId and s = :studentId "
            + "order by e.dayIndex, e.startPeriod")
    List<TimetableEntry> findForStudent(@Param("cycleId") String cycleId, @Param("studentId") String studentId);
}
