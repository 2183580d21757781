package com.freelancerpro.backend.dto;

import java.time.LocalDateTime;
import java.util.List;

import com.freelancerpro.backend.exceptions.ErrorKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private String message;
    private ErrorKind code;
    private List<String> errors;
    private LocalDateTime timestamp;

    public static <T> ApiResponse<T> success(T data, String message) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .message(message)
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorKind code, String message, List<String> errors) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(message)
                .code(code)
                .errors(errors)
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorKind code, String message) {
        return error(code, message, null);
    }
}
