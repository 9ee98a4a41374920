package com.prepcoach.interviewer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * List-valued columns hold JSON arrays.
 */
@Entity
@Table(name = "profile_analysis")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileAnalysis {

    @Id
    @Column(name = "session_id")
    private Long sessionId;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false)
    @ToString.Exclude
    private InterviewSession session;

    @Column(name = "matched_skills", columnDefinition = "TEXT")
    private String matchedSkills;

    @Column(name = "missing_skills", columnDefinition = "TEXT")
    private String missingSkills;

    @Column(columnDefinition = "TEXT")
    private String strengths;

    @Column(columnDefinition = "TEXT")
    private String weaknesses;

    @Column(name = "experience_level")
    private String experienceLevel;

    @Column(name = "red_flags", columnDefinition = "TEXT")
    private String redFlags;
}
