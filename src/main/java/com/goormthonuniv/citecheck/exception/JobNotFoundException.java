package com.goormthonuniv.citecheck.exception;

public class JobNotFoundException extends CiteCheckException {

    public JobNotFoundException(String jobId) {
        super("job not found: " + jobId);
    }
}
