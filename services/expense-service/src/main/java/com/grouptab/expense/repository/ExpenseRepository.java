package com.grouptab.expense.repository;

import com.grouptab.expense.entity.ExpenseEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for group expenses. Participants are fetched with the expense.
 */
@Repository
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    @EntityGraph(attributePaths = "participants")
    List<ExpenseEntity> findByGroupIdOrderByCreatedAtDesc(String groupId);

    @EntityGraph(attributePaths = "participants")
    List<ExpenseEntity> findByGroupIdAndEventIdOrderByCreatedAtDesc(String groupId, String eventId);

    @EntityGraph(attributePaths = "participants")
    Optional<ExpenseEntity> findByIdAndGroupId(UUID id, String groupId);
}
