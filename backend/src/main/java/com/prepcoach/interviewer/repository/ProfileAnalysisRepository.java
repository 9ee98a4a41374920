package com.prepcoach.interviewer.repository;

import com.prepcoach.interviewer.model.ProfileAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProfileAnalysisRepository extends JpaRepository<ProfileAnalysis, Long> {
}
