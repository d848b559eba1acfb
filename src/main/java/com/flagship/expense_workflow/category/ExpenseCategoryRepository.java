package com.flagship.expense_workflow.category;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExpenseCategoryRepository extends JpaRepository<ExpenseCategoryEntity, UUID> {

    List<ExpenseCategoryEntity> findByActiveTrueOrderByNameAsc();

    List<ExpenseCategoryEntity> findAllByOrderByNameAsc();
}
