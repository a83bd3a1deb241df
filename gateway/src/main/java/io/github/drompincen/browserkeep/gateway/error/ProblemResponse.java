package io.github.drompincen.browserkeep.gateway.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String code) {

    private static final String TYPE_PREFIX = "urn:browserkeep:error:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name().toLowerCase();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(TYPE_PREFIX + safeCode, httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, safeCode);
    }
}
