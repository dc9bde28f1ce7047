package com.example.userservice.mapper;

import com.example.userservice.dto.response.UserResponse;
import com.example.userservice.entity.Institution;
import com.example.userservice.entity.Role;
import com.example.userservice.entity.User;

public final class UserMapper {

    private UserMapper() {}

    public static UserResponse toUserResponse(User user) {
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getFullName(),
                user.isEmailOnReview(),
                user.isEmailOnSubmission(),
                user.isEmailOnReviewOfReview(),
                roleRef(user.getRole()),
                parentRef(user.getParent()),
                institutionRef(user.getInstitution())
        );
    }

    private static UserResponse.Ref roleRef(Role role) {
        return role == null ? UserResponse.Ref.EMPTY : new UserResponse.Ref(role.getId(), role.getName());
    }

    private static UserResponse.Ref parentRef(User parent) {
        return parent == null ? UserResponse.Ref.EMPTY : new UserResponse.Ref(parent.getId(), parent.getName());
    }

    private static UserResponse.Ref institutionRef(Institution institution) {
        return institution == null
                ? UserResponse.Ref.EMPTY
                : new UserResponse.Ref(institution.getId(), institution.getName());
    }
}
