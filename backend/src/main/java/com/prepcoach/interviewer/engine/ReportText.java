package com.prepcoach.interviewer.engine;

import lombok.Value;

@Value
public class ReportText {
    String verdict;
    String roadmap;
}
