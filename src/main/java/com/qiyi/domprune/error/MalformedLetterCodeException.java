package com.qiyi.domprune.error;

public class MalformedLetterCodeException extends DomPruneException {

    public MalformedLetterCodeException(String message) {
        super(ErrorKind.MALFORMED_LETTER_CODE, message);
    }
}
