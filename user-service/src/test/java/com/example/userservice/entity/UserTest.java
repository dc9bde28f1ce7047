package com.example.userservice.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserTest {

    @Test
    @DisplayName("new user gets default preference flags")
    void defaultsOnConstruction() {
        User user = new User();

        assertThat(user.isNewUser()).isTrue();
        assertThat(user.isEtcIconsOnHomepage()).isTrue();
        assertThat(user.isCopyOfEmails()).isFalse();
        assertThat(user.isEmailOnReview()).isFalse();
        assertThat(user.isEmailOnSubmission()).isFalse();
        assertThat(user.isEmailOnReviewOfReview()).isFalse();
        assertThat(user.getChildren()).isEmpty();
    }

    @Test
    @DisplayName("role predicates delegate to the role kind")
    void rolePredicates() {
        User user = new User();
        user.setRole(Role.builder().name("Teaching Assistant").kind(RoleKind.TEACHING_ASSISTANT).build());

        assertThat(user.isTeachingAssistant()).isTrue();
        assertThat(user.isStudent()).isFalse();
        assertThat(user.isInstructor()).isFalse();
    }

    @Test
    @DisplayName("equality is by id, transient instances by identity")
    void equality() {
        User a = new User();
        User b = new User();
        assertThat(a).isNotEqualTo(b);

        a.setId(7L);
        b.setId(7L);
        assertThat(a).isEqualTo(b);
    }
}
