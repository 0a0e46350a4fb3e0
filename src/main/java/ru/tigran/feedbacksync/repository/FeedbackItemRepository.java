package ru.tigran.feedbacksync.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.feedbacksync.model.FeedbackItem;

@Repository
public interface FeedbackItemRepository extends JpaRepository<FeedbackItem, String> {
}
