package com.gbu.courseplatform.security;

import com.gbu.courseplatform.modules.user.User;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The caller of a request, as resolved from its bearer token. Passed
 * explicitly to every service operation.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AuthenticatedUser {
    private final Long id;
    private final String email;
    private final User.Role role;

    public AuthenticatedUser(Long id, String email, User.Role role) {
        this.id = id;
        this.email = email;
        this.role = role;
    }

    public boolean isTeacher() {
        return role == User.Role.TEACHER;
    }

    public boolean isStudent() {
        return role == User.Role.STUDENT;
    }
}
