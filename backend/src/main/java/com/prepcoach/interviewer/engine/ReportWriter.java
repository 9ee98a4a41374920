package com.prepcoach.interviewer.engine;

public interface ReportWriter {

    ReportText write(ReportRequest request);
}
