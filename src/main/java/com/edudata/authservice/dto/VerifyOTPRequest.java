package com.edudata.authservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyOTPRequest {

    @NotBlank(message = "sessionToken is required")
    @Size(max = 128)
    private String sessionToken;

    @NotBlank(message = "code is required")
    @Size(max = 16)
    private String code;
}
