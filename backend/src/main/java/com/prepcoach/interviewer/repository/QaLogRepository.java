package com.prepcoach.interviewer.repository;

import com.prepcoach.interviewer.model.QaLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QaLogRepository extends JpaRepository<QaLog, Long> {

    List<QaLog> findBySessionIdOrderByQuestionNumberAsc(Long sessionId);
}
