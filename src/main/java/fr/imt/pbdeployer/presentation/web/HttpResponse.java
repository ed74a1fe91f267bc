package fr.imt.pbdeployer.presentation.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope of error responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HttpResponse<T> {

    private boolean success;
    private String error;
    private String message;
    private T data;
    private Instant timestamp;

    public static <T> HttpResponse<T> ok(T data) {
        return new HttpResponse<>(true, null, null, data, Instant.now());
    }

    public static <T> HttpResponse<T> error(String error) {
        return new HttpResponse<>(false, error, null, null, Instant.now());
    }

    public static <T> HttpResponse<T> error(String error, String message) {
        return new HttpResponse<>(false, error, message, null, Instant.now());
    }
}
