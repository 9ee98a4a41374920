package com.prepcoach.interviewer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "sessions")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterviewSession {

    /** Assigned by the interview engine, not the database. */
    @Id
    private Long id;

    @Column(name = "candidate_name")
    private String candidateName;

    private String company;

    private String role;

    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "overall_score")
    private Double overallScore;

    @Column(name = "final_verdict", columnDefinition = "TEXT")
    private String finalVerdict;

    @Column(name = "resume_length")
    private Integer resumeLength;

    @Column(name = "total_questions")
    private Integer totalQuestions = 0;

    @Column(name = "early_termination", columnDefinition = "TEXT")
    private String earlyTermination;
}
