package org.nowstart.folio.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class FolioApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public FolioApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
