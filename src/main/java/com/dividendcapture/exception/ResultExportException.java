package com.dividendcapture.exception;

public class ResultExportException extends BaseException {

    public ResultExportException(String message, Throwable cause) {
        super(ErrorCode.OUTPUT_WRITE_FAILED, message, cause);
    }
}
