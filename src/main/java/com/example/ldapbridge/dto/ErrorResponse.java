package com.example.ldapbridge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorResponse {

    private String timestamp;

    private Integer status;

    private String error;

    // failure kind, e.g. "UserNotFound"
    private String code;

    private String message;

    private String path;
}
