package com.prepcoach.interviewer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterviewPrepCoachApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewPrepCoachApplication.class, args);
    }
}
