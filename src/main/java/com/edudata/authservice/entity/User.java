package com.edudata.authservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.io.Serial;
import java.io.Serializable;

/**
 * Account record. {@code identifier} is either an e-mail address or a login id
 * (student id, staff id), stored trimmed and lower-cased.
 */
@Entity
@Table(name = "users", indexes = {
        @Index(name = "ux_users_identifier", columnList = "identifier", unique = true)
})
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@SuperBuilder
@ToString(exclude = "passwordHash")
public class User extends BaseEntity implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    @NotBlank
    @Size(max = 320)
    @Column(nullable = false, unique = true, length = 320)
    private String identifier;

    @Size(max = 120)
    @Column(name = "display_name", length = 120)
    private String displayName;

    @NotBlank
    @Column(name = "password_hash", nullable = false, length = 100)
    @JsonIgnore
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 30)
    @Builder.Default
    private UserRole role = UserRole.STUDENT;

    /** Phone (E.164, e.g. +91...) or e-mail the one-time code is sent to. */
    @Size(max = 320)
    @Column(length = 320)
    private String contact;

    /** Where one-time codes go: the explicit contact, else the identifier itself. */
    public String otcContact() {
        return (contact != null && !contact.isBlank()) ? contact : identifier;
    }
}
