package lab.escrow.orchestration;

import lab.escrow.common.error.ErrorKind;
import lab.escrow.common.error.EscrowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<EscrowErrorResponse> handleEscrowException(EscrowException e) {
        HttpStatus status = statusOf(e.getKind());
        log.warn("event=api.escrow_error code={} kind={} status={} message={}", e.getCode(), e.getKind(), status.value(), e.getMessage());
        return ResponseEntity
                .status(status)
                .body(new EscrowErrorResponse(status.value(), e.getCode().name(), e.getKind().name(), e.getMessage()));
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE, BUSINESS -> HttpStatus.CONFLICT;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case FUNDING -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    public record EscrowErrorResponse(
            int status,
            String code,
            String kind,
            String message
    ) {}
}
