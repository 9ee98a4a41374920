package com.prepcoach.interviewer.repository;

import com.prepcoach.interviewer.model.InterviewSession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InterviewSessionRepository extends JpaRepository<InterviewSession, Long> {

    List<InterviewSession> findAllByOrderByStartTimeDesc(Pageable pageable);

    @Query("SELECT MAX(s.id) FROM InterviewSession s")
    Optional<Long> findMaxId();
}
