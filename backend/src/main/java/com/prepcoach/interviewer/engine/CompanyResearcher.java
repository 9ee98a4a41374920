package com.prepcoach.interviewer.engine;

public interface CompanyResearcher {

    String research(String companyName);
}
