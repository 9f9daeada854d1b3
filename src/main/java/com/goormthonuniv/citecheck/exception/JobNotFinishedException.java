package com.goormthonuniv.citecheck.exception;

public class JobNotFinishedException extends CiteCheckException {

    public JobNotFinishedException(String jobId, String status) {
        super("job " + jobId + " is not finished (status=" + status + ")");
    }
}
