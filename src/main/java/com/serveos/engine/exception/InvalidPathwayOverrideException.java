package com.serveos.engine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidPathwayOverrideException extends ErrorResponseException {

    public InvalidPathwayOverrideException(String detail) {
        super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
    }

    private static ProblemDetail createProblem(String detail) {
        var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        problem.setTitle("Invalid pathway override");
        problem.setDetail(detail);
        return problem;
    }
}
