package ru.tigran.feedbacksync.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.feedbacksync.model.FeedbackGroup;

import java.util.List;

@Repository
public interface FeedbackGroupRepository extends JpaRepository<FeedbackGroup, String> {

    /**
     * Largest groups first, the order in which clients render them.
     */
    List<FeedbackGroup> findAllByOrderByItemCountDesc();
}
