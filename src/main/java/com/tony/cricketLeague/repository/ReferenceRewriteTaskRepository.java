package com.tony.cricketLeague.repository;

import com.tony.cricketLeague.model.ReferenceRewriteTask;
import com.tony.cricketLeague.model.RewriteTaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReferenceRewriteTaskRepository extends JpaRepository<ReferenceRewriteTask, Long> {
    List<ReferenceRewriteTask> findByStatusOrderByCreatedAtAsc(RewriteTaskStatus status);
}
