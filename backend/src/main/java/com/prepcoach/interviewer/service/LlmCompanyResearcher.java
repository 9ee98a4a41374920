package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.CompanyResearcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmCompanyResearcher implements CompanyResearcher {

    private final LlmClient llmClient;

    @Override
    public String research(String companyName) {
        log.info("Researching {}", companyName);
        String prompt = """
                Summarize what a candidate should know about %s in 3-4 sentences:
                culture and values, interview style (technical vs behavioral focus),
                and what they look for in candidates. Be specific and actionable.
                """.formatted(companyName);
        return llmClient.generate(prompt, 0.3);
    }
}
