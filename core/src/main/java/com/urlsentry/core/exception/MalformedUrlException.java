package com.urlsentry.core.exception;

/** 절대 http/https URL이 아닌 입력. 네트워크 호출 전에 던져진다. */
public class MalformedUrlException extends UrlSentryException {
    private final String input;

    public MalformedUrlException(String input, String developerDetails) {
        super(ErrorCode.MALFORMED_URL, "The URL is not a valid absolute http(s) address", developerDetails);
        this.input = input;
    }

    public MalformedUrlException(String input, String developerDetails, Throwable cause) {
        super(ErrorCode.MALFORMED_URL, "The URL is not a valid absolute http(s) address", developerDetails, cause);
        this.input = input;
    }

    public String getInput() { return input; }
}
