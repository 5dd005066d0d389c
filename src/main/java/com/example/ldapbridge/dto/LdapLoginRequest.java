package com.example.ldapbridge.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LdapLoginRequest {

    @NotBlank(message = "Username is required")
    private String username;

    @ToString.Exclude
    private String password;
}
