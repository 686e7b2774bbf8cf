package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.AllocationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AllocationRuleRepository extends JpaRepository<AllocationRule, Long> {

    List<AllocationRule> findAllByOrderByIdAsc();

    boolean existsByName(String name);
}
