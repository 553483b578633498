package com.university.clashfree.repository;

import com.university.clashfree.model.PlanningCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlanningCycleRepository extends JpaRepository<PlanningCycle, String> {
}
