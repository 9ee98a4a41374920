package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QaLogDto {
    private Integer questionNumber;
    private String stage;
    private String question;
    private String answer;
    private Integer answerLength;
    private Double criticScore;
    private String criticStrengths;
    private String criticWeaknesses;
    private String criticTip;
    private String sentiment;
    private LocalDateTime timestamp;
}
