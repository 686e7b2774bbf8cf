package com.microsoft.finops.domain.repository;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.domain.model.PolicyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PolicyRepository extends JpaRepository<Policy, Long> {

    List<Policy> findByStatusOrderByIdAsc(PolicyStatus status);

    List<Policy> findAllByOrderByIdAsc();

    boolean existsByName(String name);
}
