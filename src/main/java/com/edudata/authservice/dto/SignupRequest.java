package com.edudata.authservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.edudata.authservice.entity.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignupRequest {

    @NotBlank(message = "identifier is required")
    @Size(max = 320, message = "identifier must be <= 320 characters")
    @JsonAlias({"email", "loginId"})
    private String identifier;

    @NotBlank(message = "password is required")
    @Size(max = 256, message = "password must be <= 256 characters")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @NotBlank(message = "displayName is required")
    @Size(max = 120, message = "displayName must be <= 120 characters")
    @JsonAlias({"display_name", "name"})
    private String displayName;

    /** Phone in E.164 form (+91...) or e-mail; defaults to the identifier. */
    @Size(max = 320, message = "contact must be <= 320 characters")
    @JsonAlias("phone")
    private String contact;

    private UserRole role;
}
