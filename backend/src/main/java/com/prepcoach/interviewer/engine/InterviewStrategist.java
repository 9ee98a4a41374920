package com.prepcoach.interviewer.engine;

public interface InterviewStrategist {

    InterviewStrategy plan(ProfileSnapshot profile, String companyIntel);
}
