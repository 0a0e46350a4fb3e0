package ru.tigran.feedbacksync.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.feedbacksync.model.SyncState;

@Repository
public interface SyncStateRepository extends JpaRepository<SyncState, String> {
}
