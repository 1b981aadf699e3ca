package com.edudata.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignupResponse {
    private Boolean ok;
    private String message;
    private UserSummary user;
    private String token;
}
