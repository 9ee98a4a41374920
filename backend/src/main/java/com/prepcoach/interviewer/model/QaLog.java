package com.prepcoach.interviewer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One row per answered question, pushback retries included. Append-only.
 */
@Entity
@Table(name = "qa_logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QaLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false)
    @ToString.Exclude
    private InterviewSession session;

    @Column(name = "question_number", nullable = false)
    private Integer questionNumber;

    private String stage;

    @Column(columnDefinition = "TEXT")
    private String question;

    @Column(columnDefinition = "TEXT")
    private String answer;

    @Column(name = "answer_length")
    private Integer answerLength;

    @Column(name = "critic_score")
    private Double criticScore;

    @Column(name = "critic_strengths", columnDefinition = "TEXT")
    private String criticStrengths;

    @Column(name = "critic_weaknesses", columnDefinition = "TEXT")
    private String criticWeaknesses;

    @Column(name = "critic_tip", columnDefinition = "TEXT")
    private String criticTip;

    private String sentiment;

    private LocalDateTime timestamp;
}
