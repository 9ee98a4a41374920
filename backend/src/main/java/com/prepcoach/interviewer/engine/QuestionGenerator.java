package com.prepcoach.interviewer.engine;

import com.prepcoach.interviewer.exception.CollaboratorException;

public interface QuestionGenerator {

    /**
     * @return the question text; blank text is replaced by a stage fallback
     * @throws CollaboratorException when the generation call fails
     */
    String generate(QuestionRequest request);
}
