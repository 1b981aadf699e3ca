package com.edudata.authservice.dto;

import com.edudata.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String identifier;
    private String displayName;
    private String role;
    private String contact;

    public static UserSummary from(User user) {
        return profileOf(user).toBuilder().contact(user.getContact()).build();
    }

    /** The /auth/me shape: no contact details. */
    public static UserSummary profileOf(User user) {
        return UserSummary.builder()
                .id(user.getId() != null ? user.getId().toString() : null)
                .identifier(user.getIdentifier())
                .displayName(user.getDisplayName())
                .role(user.getRole().name())
                .build();
    }
}
