package com.example.userservice.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profile view of a user.
 * Absent role/parent/institution references are rendered as {id: null, name: null}.
 */
public record UserResponse(
    @JsonProperty("id")
    Long id,

    @JsonProperty("name")
    String name,

    @JsonProperty("email")
    String email,

    @JsonProperty("full_name")
    String fullName,

    @JsonProperty("email_on_review")
    boolean emailOnReview,

    @JsonProperty("email_on_submission")
    boolean emailOnSubmission,

    @JsonProperty("email_on_review_of_review")
    boolean emailOnReviewOfReview,

    @JsonProperty("role")
    Ref role,

    @JsonProperty("parent")
    Ref parent,

    @JsonProperty("institution")
    Ref institution
) {

    /**
     * Id and name of a referenced record.
     */
    public record Ref(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name
    ) {
        public static final Ref EMPTY = new Ref(null, null);
    }
}
