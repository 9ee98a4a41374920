package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionStartResponseDto {
    private Long sessionId;
    private String question;
    private Integer questionNumber;
    private String stage;
    private String persona;
    private List<String> warnings;
}
